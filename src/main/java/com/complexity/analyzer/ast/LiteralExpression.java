package com.complexity.analyzer.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * A decimal number literal, kept as written.
 */
public final class LiteralExpression extends Expression {

    private final String text;
    private final BigDecimal value;

    public LiteralExpression(int line, int column, String text) {
        super(line, column);
        this.text = text;
        this.value = new BigDecimal(text.startsWith(".") ? "0" + text : text);
    }

    public String getText() {
        return text;
    }

    public BigDecimal getValue() {
        return value;
    }

    @Override
    public Optional<BigInteger> integerValue() {
        try {
            return Optional.of(value.toBigIntegerExact());
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public String toString() {
        return text;
    }
}
