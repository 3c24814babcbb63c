package com.complexity.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class AssignmentStatement extends Statement {

    private final VariableExpression target;
    private final Expression value;

    public AssignmentStatement(VariableExpression target, Expression value) {
        super(target.getLine(), target.getColumn());
        this.target = target;
        this.value = Objects.requireNonNull(value);
    }

    public VariableExpression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGNMENT;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(target, value);
    }

    @Override
    public String header() {
        return target + " ← " + value;
    }

    @Override
    public String toString() {
        return header();
    }
}
