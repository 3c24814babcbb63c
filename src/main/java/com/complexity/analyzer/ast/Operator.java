package com.complexity.analyzer.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators of the dialect with their binding strength; a higher precedence binds tighter.
 */
public enum Operator {
    OR("or", 1),
    AND("and", 2),
    NOT("not", 3),
    LESS_EQUAL("≤", 4),
    GREATER_EQUAL("≥", 4),
    NOT_EQUAL("≠", 4),
    EQUAL("=", 4),
    LESS("<", 4),
    GREATER(">", 4),
    PLUS("+", 5),
    MINUS("-", 5),
    TIMES("*", 6),
    DIVIDE("/", 6),
    DIV("div", 6),
    MOD("mod", 6);

    /** Binding strength of prefix {@code +} and {@code -}. */
    public static final int UNARY_PRECEDENCE = 7;

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isRelational() {
        return precedence == 4;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
