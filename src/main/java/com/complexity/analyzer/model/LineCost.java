package com.complexity.analyzer.model;

import com.complexity.analyzer.cost.CostExpression;

import java.util.Objects;

/**
 * Cost charged to one source line during an analysis. Only used to explain a result.
 */
public final class LineCost {

    private final int line;
    private final String description;
    private final CostExpression worstCost;
    private final CostExpression bestCost;

    public LineCost(int line, String description, CostExpression worstCost, CostExpression bestCost) {
        this.line = line;
        this.description = Objects.requireNonNull(description);
        this.worstCost = Objects.requireNonNull(worstCost);
        this.bestCost = Objects.requireNonNull(bestCost);
    }

    public LineCost(int line, String description, CostExpression cost) {
        this(line, description, cost, cost);
    }

    public int getLine() {
        return line;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the worst-case cost of the line
     */
    public CostExpression getCost() {
        return worstCost;
    }

    public CostExpression getBestCost() {
        return bestCost;
    }

    /**
     * Same entry with its description prefixed, used when a nested trace is merged into the
     * trace of the enclosing statement.
     */
    public LineCost tagged(String tag) {
        return new LineCost(line, tag + " " + description, worstCost, bestCost);
    }

    public String formatCost() {
        String text = "worst: " + worstCost;
        if (!worstCost.equals(bestCost)) {
            text += ", best: " + bestCost;
        }
        return text;
    }

    @Override
    public String toString() {
        return "line " + line + ": " + description + " [" + formatCost() + "]";
    }
}
