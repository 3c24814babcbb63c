package com.complexity.analyzer.ast;

import java.util.List;

/**
 * A procedure call used as a statement, e.g. {@code EXCHANGE(A, i, j)}.
 */
public final class CallStatement extends Statement {

    private final CallExpression call;

    public CallStatement(CallExpression call) {
        super(call.getLine(), call.getColumn());
        this.call = call;
    }

    public CallExpression getCall() {
        return call;
    }

    public String getName() {
        return call.getName();
    }

    public List<Expression> getArguments() {
        return call.getArguments();
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(call);
    }

    @Override
    public String header() {
        return call.toString();
    }

    @Override
    public String toString() {
        return header();
    }
}
