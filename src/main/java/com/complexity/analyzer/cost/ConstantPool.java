package com.complexity.analyzer.cost;

/**
 * Hands out fresh constants {@code c_1, c_2, ...}. One pool belongs to one analysis; it is
 * threaded through the recursive cost computation and never shared between analyses.
 */
public final class ConstantPool {

    private int next = 1;

    public CostExpression fresh() {
        return CostExpression.constant(next++);
    }

    /**
     * @return how many constants have been handed out
     */
    public int size() {
        return next - 1;
    }
}
