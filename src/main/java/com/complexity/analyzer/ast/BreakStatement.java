package com.complexity.analyzer.ast;

import java.util.List;

public final class BreakStatement extends Statement {

    public BreakStatement(int line, int column) {
        super(line, column);
    }

    @Override
    public Kind getKind() {
        return Kind.BREAK;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public String header() {
        return "break";
    }

    @Override
    public String toString() {
        return header();
    }
}
