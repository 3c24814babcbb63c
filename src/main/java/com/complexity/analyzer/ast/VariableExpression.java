package com.complexity.analyzer.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A variable reference with optional field and index accessors, e.g. {@code A[i]} or
 * {@code A.length}. Indices are 1-based in the dialect; the tree keeps them as written.
 */
public final class VariableExpression extends Expression {

    /**
     * One {@code .field} or {@code [index]} suffix.
     */
    public static final class Accessor {
        private final String field;
        private final Expression index;

        private Accessor(String field, Expression index) {
            this.field = field;
            this.index = index;
        }

        public static Accessor field(String name) {
            return new Accessor(Objects.requireNonNull(name), null);
        }

        public static Accessor index(Expression index) {
            return new Accessor(null, Objects.requireNonNull(index));
        }

        public boolean isIndex() {
            return index != null;
        }

        public String getField() {
            return field;
        }

        public Expression getIndex() {
            return index;
        }

        @Override
        public String toString() {
            return isIndex() ? "[" + index + "]" : "." + field;
        }
    }

    private final String name;
    private final List<Accessor> accessors;

    public VariableExpression(int line, int column, String name, List<Accessor> accessors) {
        super(line, column);
        this.name = Objects.requireNonNull(name);
        this.accessors = List.copyOf(accessors);
    }

    public String getName() {
        return name;
    }

    public List<Accessor> getAccessors() {
        return accessors;
    }

    public List<Expression> getIndices() {
        List<Expression> indices = new ArrayList<>();
        for (Accessor accessor : accessors) {
            if (accessor.isIndex()) {
                indices.add(accessor.getIndex());
            }
        }
        return indices;
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.copyOf(getIndices());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        accessors.forEach(sb::append);
        return sb.toString();
    }
}
