package com.complexity.analyzer.ast;

import java.math.BigInteger;
import java.util.Optional;

public abstract class Expression extends Node {

    public enum Kind {
        LITERAL, VARIABLE, BINARY, UNARY, CALL
    }

    protected Expression(int line, int column) {
        super(line, column);
    }

    public abstract Kind getKind();

    /**
     * Binding strength used when printing; atoms bind tightest.
     */
    public int precedence() {
        return Integer.MAX_VALUE;
    }

    /**
     * @return the value of an integer literal (possibly negated), empty for anything else
     */
    public Optional<BigInteger> integerValue() {
        return Optional.empty();
    }

    static String wrap(Expression child, int parentPrecedence, boolean strict) {
        boolean parens = strict ? child.precedence() <= parentPrecedence : child.precedence() < parentPrecedence;
        return parens ? "(" + child + ")" : child.toString();
    }
}
