package com.complexity.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class BinaryExpression extends Expression {

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(Operator operator, Expression left, Expression right) {
        super(left.getLine(), left.getColumn());
        this.operator = Objects.requireNonNull(operator);
        this.left = left;
        this.right = Objects.requireNonNull(right);
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public int precedence() {
        return operator.getPrecedence();
    }

    @Override
    public Kind getKind() {
        return Kind.BINARY;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return wrap(left, precedence(), false) + " " + operator + " " + wrap(right, precedence(), true);
    }
}
