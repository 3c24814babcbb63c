package com.complexity.analyzer.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Root of a parsed pseudocode text: the top-level statements and function declarations in
 * source order.
 */
public final class Program extends Node {

    private final List<Statement> items;

    public Program(List<Statement> items) {
        super(items.isEmpty() ? 1 : items.get(0).getLine(), items.isEmpty() ? 1 : items.get(0).getColumn());
        if (items.isEmpty()) {
            throw new IllegalArgumentException("A program needs at least one statement");
        }
        this.items = List.copyOf(items);
    }

    public List<Statement> getItems() {
        return items;
    }

    public List<FunctionDeclaration> getFunctions() {
        return items.stream()
                .filter(item -> item.getKind() == Statement.Kind.FUNCTION)
                .map(FunctionDeclaration.class::cast)
                .collect(Collectors.toList());
    }

    @Override
    public List<Node> getChildNodes() {
        return List.copyOf(items);
    }

    @Override
    public String toString() {
        return items.stream().map(Statement::toString).collect(Collectors.joining("\n"));
    }
}
