package com.complexity.analyzer.cost;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Symbolic operation count over the problem size {@code n} and opaque positive constants
 * {@code c_1, c_2, ...}.
 * <p>
 * Expressions are immutable trees built from numbers, constants, {@code n}, addition,
 * {@code max}, {@code min} and bounded sums. {@link #canonical()} evaluates a tree into a
 * {@link Polynomial}; two expressions are equal when their canonical forms are.
 */
public abstract class CostExpression {

    public enum Kind {
        NUMBER, CONSTANT, SIZE, ADD, MAX, MIN, SUM
    }

    public static final CostExpression ZERO = new NumberExpr(BigInteger.ZERO);
    public static final CostExpression ONE = new NumberExpr(BigInteger.ONE);
    public static final CostExpression N = new SizeExpr();

    private Polynomial canonical;

    public abstract Kind getKind();

    protected abstract Polynomial evaluate();

    /**
     * Canonical polynomial of this expression: sums expanded, like terms collected.
     */
    public final synchronized Polynomial canonical() {
        if (canonical == null) {
            canonical = evaluate();
        }
        return canonical;
    }

    /**
     * Growth degree in {@code n} of the dominant term.
     */
    public int degree() {
        return canonical().degree();
    }

    public boolean isZero() {
        return canonical().isZero();
    }

    public static CostExpression number(long value) {
        return new NumberExpr(BigInteger.valueOf(value));
    }

    public static CostExpression number(BigInteger value) {
        return new NumberExpr(value);
    }

    public static CostExpression constant(int index) {
        return new ConstantExpr("c_" + index);
    }

    public CostExpression plus(CostExpression other) {
        if (isLiteralZero(other)) return this;
        if (isLiteralZero(this)) return other;
        List<CostExpression> operands = new ArrayList<>();
        flattenInto(this, operands);
        flattenInto(other, operands);
        return new AddExpr(operands);
    }

    public static CostExpression max(CostExpression a, CostExpression b) {
        return new ExtremumExpr(Kind.MAX, a, b);
    }

    public static CostExpression min(CostExpression a, CostExpression b) {
        return new ExtremumExpr(Kind.MIN, a, b);
    }

    /**
     * {@code Σ_{variable=lower}^{upper} body}. The bounds may only depend on {@code n}.
     */
    public static CostExpression sum(CostExpression body, String variable, CostExpression lower, CostExpression upper) {
        return new SumExpr(body, variable, lower, upper);
    }

    private static boolean isLiteralZero(CostExpression expression) {
        return expression.getKind() == Kind.NUMBER && ((NumberExpr) expression).value.signum() == 0;
    }

    private static void flattenInto(CostExpression expression, List<CostExpression> operands) {
        if (expression.getKind() == Kind.ADD) {
            operands.addAll(((AddExpr) expression).operands);
        } else {
            operands.add(expression);
        }
    }

    private static String parenthesize(CostExpression expression) {
        return expression.getKind() == Kind.ADD ? "(" + expression + ")" : expression.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CostExpression)) return false;
        return canonical().equals(((CostExpression) o).canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }

    private static final class NumberExpr extends CostExpression {
        private final BigInteger value;

        NumberExpr(BigInteger value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.NUMBER;
        }

        @Override
        protected Polynomial evaluate() {
            return Polynomial.number(value);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    private static final class ConstantExpr extends CostExpression {
        private final String name;

        ConstantExpr(String name) {
            this.name = name;
        }

        @Override
        public Kind getKind() {
            return Kind.CONSTANT;
        }

        @Override
        protected Polynomial evaluate() {
            return Polynomial.constant(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class SizeExpr extends CostExpression {
        @Override
        public Kind getKind() {
            return Kind.SIZE;
        }

        @Override
        protected Polynomial evaluate() {
            return Polynomial.size();
        }

        @Override
        public String toString() {
            return "n";
        }
    }

    private static final class AddExpr extends CostExpression {
        private final List<CostExpression> operands;

        AddExpr(List<CostExpression> operands) {
            this.operands = List.copyOf(operands);
        }

        @Override
        public Kind getKind() {
            return Kind.ADD;
        }

        @Override
        protected Polynomial evaluate() {
            Polynomial result = Polynomial.ZERO;
            for (CostExpression operand : operands) {
                result = result.plus(operand.canonical());
            }
            return result;
        }

        @Override
        public String toString() {
            return operands.stream().map(CostExpression::toString).collect(Collectors.joining(" + "));
        }
    }

    private static final class ExtremumExpr extends CostExpression {
        private final Kind kind;
        private final CostExpression left;
        private final CostExpression right;

        ExtremumExpr(Kind kind, CostExpression left, CostExpression right) {
            this.kind = kind;
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        @Override
        public Kind getKind() {
            return kind;
        }

        @Override
        protected Polynomial evaluate() {
            return kind == Kind.MAX
                    ? Polynomial.max(left.canonical(), right.canonical())
                    : Polynomial.min(left.canonical(), right.canonical());
        }

        @Override
        public String toString() {
            return (kind == Kind.MAX ? "max(" : "min(") + left + ", " + right + ")";
        }
    }

    private static final class SumExpr extends CostExpression {
        private final CostExpression body;
        private final String variable;
        private final CostExpression lower;
        private final CostExpression upper;

        SumExpr(CostExpression body, String variable, CostExpression lower, CostExpression upper) {
            this.body = Objects.requireNonNull(body);
            this.variable = Objects.requireNonNull(variable);
            this.lower = Objects.requireNonNull(lower);
            this.upper = Objects.requireNonNull(upper);
        }

        @Override
        public Kind getKind() {
            return Kind.SUM;
        }

        /*
         * Loop bodies never depend on the summation variable, so the sum is the body times the
         * number of terms. An empty range contributes nothing.
         */
        @Override
        protected Polynomial evaluate() {
            Polynomial count = upper.canonical().minus(lower.canonical()).plus(Polynomial.number(1));
            if (!count.isScalar()) {
                throw new IllegalStateException("Summation bounds must only depend on n: " + this);
            }
            if (count.leadingCoefficient().signum() <= 0) {
                return Polynomial.ZERO;
            }
            return body.canonical().times(count);
        }

        @Override
        public String toString() {
            return "Σ_{" + variable + "=" + lower + "}^{" + upper + "} " + parenthesize(body);
        }
    }
}
