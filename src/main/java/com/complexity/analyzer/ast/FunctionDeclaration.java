package com.complexity.analyzer.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code NAME(p1, p2, ...)} followed by an indented body. Only allowed at the top level.
 */
public final class FunctionDeclaration extends Statement {

    private final String name;
    private final List<String> parameters;
    private final Block body;

    public FunctionDeclaration(int line, int column, String name, List<String> parameters, Block body) {
        super(line, column);
        this.name = Objects.requireNonNull(name);
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body);
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(body);
    }

    @Override
    public String header() {
        return name + "(" + String.join(", ", parameters) + ")";
    }

    @Override
    public String toString() {
        return header() + "\n" + body.indented();
    }
}
