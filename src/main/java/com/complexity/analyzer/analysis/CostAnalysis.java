package com.complexity.analyzer.analysis;

import com.complexity.analyzer.cost.CostExpression;
import com.complexity.analyzer.model.LineCost;

import java.util.List;
import java.util.Objects;

/**
 * Worst- and best-case cost of a program fragment together with the line trace that explains
 * it. Returned by every step of the recursive cost computation.
 */
public final class CostAnalysis {

    public static final CostAnalysis EMPTY = new CostAnalysis(CostExpression.ZERO, CostExpression.ZERO, List.of());

    private final CostExpression worstCase;
    private final CostExpression bestCase;
    private final List<LineCost> trace;

    public CostAnalysis(CostExpression worstCase, CostExpression bestCase, List<LineCost> trace) {
        this.worstCase = Objects.requireNonNull(worstCase);
        this.bestCase = Objects.requireNonNull(bestCase);
        this.trace = List.copyOf(trace);
    }

    public CostExpression getWorstCase() {
        return worstCase;
    }

    public CostExpression getBestCase() {
        return bestCase;
    }

    public List<LineCost> getTrace() {
        return trace;
    }
}
