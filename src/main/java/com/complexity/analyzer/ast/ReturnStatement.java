package com.complexity.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class ReturnStatement extends Statement {

    private final Expression value;

    public ReturnStatement(int line, int column, Expression value) {
        super(line, column);
        this.value = Objects.requireNonNull(value);
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.RETURN;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(value);
    }

    @Override
    public String header() {
        return "return " + value;
    }

    @Override
    public String toString() {
        return header();
    }
}
