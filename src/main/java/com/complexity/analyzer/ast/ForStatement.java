package com.complexity.analyzer.ast;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code for var ← from to|downto to do body}. Both bounds are always present.
 */
public final class ForStatement extends Statement {

    public enum Direction {
        TO("to"), DOWNTO("downto");

        private final String keyword;

        Direction(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final String variable;
    private final Expression from;
    private final Expression to;
    private final Direction direction;
    private final Block body;

    public ForStatement(int line, int column, String variable, Expression from, Direction direction,
                        Expression to, Block body) {
        super(line, column);
        this.variable = Objects.requireNonNull(variable);
        this.from = Objects.requireNonNull(from, "for loop needs a lower bound");
        this.direction = Objects.requireNonNull(direction);
        this.to = Objects.requireNonNull(to, "for loop needs an upper bound");
        this.body = Objects.requireNonNull(body);
    }

    public String getVariable() {
        return variable;
    }

    public Expression getFrom() {
        return from;
    }

    public Expression getTo() {
        return to;
    }

    public Direction getDirection() {
        return direction;
    }

    public Block getBody() {
        return body;
    }

    /**
     * Number of iterations when both bounds are integer literals; empty when the trip count
     * depends on the input.
     */
    public Optional<BigInteger> concreteTripCount() {
        Optional<BigInteger> low = from.integerValue();
        Optional<BigInteger> high = to.integerValue();
        if (low.isEmpty() || high.isEmpty()) {
            return Optional.empty();
        }
        BigInteger span = direction == Direction.TO
                ? high.get().subtract(low.get())
                : low.get().subtract(high.get());
        return Optional.of(span.add(BigInteger.ONE).max(BigInteger.ZERO));
    }

    @Override
    public Kind getKind() {
        return Kind.FOR;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(from, to, body);
    }

    @Override
    public String header() {
        return "for " + variable + " ← " + from + " " + direction.getKeyword() + " " + to + " do";
    }

    @Override
    public String toString() {
        return header() + "\n" + body.indented();
    }
}
