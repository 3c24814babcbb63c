package com.complexity.analyzer.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class CallExpression extends Expression {

    private final String name;
    private final List<Expression> arguments;

    public CallExpression(int line, int column, String name, List<Expression> arguments) {
        super(line, column);
        this.name = Objects.requireNonNull(name);
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.copyOf(arguments);
    }

    @Override
    public String toString() {
        return name + "(" + arguments.stream().map(Expression::toString).collect(Collectors.joining(", ")) + ")";
    }
}
