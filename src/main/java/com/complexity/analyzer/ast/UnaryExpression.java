package com.complexity.analyzer.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prefix {@code not}, {@code +} or {@code -}.
 */
public final class UnaryExpression extends Expression {

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(int line, int column, Operator operator, Expression operand) {
        super(line, column);
        this.operator = Objects.requireNonNull(operator);
        this.operand = Objects.requireNonNull(operand);
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public int precedence() {
        return operator == Operator.NOT ? Operator.NOT.getPrecedence() : Operator.UNARY_PRECEDENCE;
    }

    @Override
    public Optional<BigInteger> integerValue() {
        if (operator == Operator.NOT) {
            return Optional.empty();
        }
        Optional<BigInteger> inner = operand.integerValue();
        return operator == Operator.MINUS ? inner.map(BigInteger::negate) : inner;
    }

    @Override
    public Kind getKind() {
        return Kind.UNARY;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        String prefix = operator == Operator.NOT ? "not " : operator.getSymbol();
        return prefix + wrap(operand, precedence(), false);
    }
}
