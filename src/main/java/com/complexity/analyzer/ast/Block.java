package com.complexity.analyzer.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Non-empty sequence of statements forming the body of a branch, loop or function.
 */
public final class Block extends Node {

    private final List<Statement> statements;

    public Block(List<Statement> statements) {
        super(first(statements).getLine(), first(statements).getColumn());
        this.statements = List.copyOf(statements);
    }

    private static Statement first(List<Statement> statements) {
        if (statements.isEmpty()) {
            throw new IllegalArgumentException("A block needs at least one statement");
        }
        return statements.get(0);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.copyOf(statements);
    }

    String indented() {
        return statements.stream()
                .map(s -> "    " + s.toString().replace("\n", "\n    "))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return indented();
    }
}
