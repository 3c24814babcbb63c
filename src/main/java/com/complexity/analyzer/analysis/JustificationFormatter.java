package com.complexity.analyzer.analysis;

import com.complexity.analyzer.model.ComplexityResult;
import com.complexity.analyzer.model.LineCost;

/**
 * Renders the line-by-line justification of a complexity result. Pure string assembly.
 */
public class JustificationFormatter {

    public String format(CostAnalysis analysis, DominantTerm worst, DominantTerm best,
                         String bigO, String bigOmega, String bigTheta) {
        StringBuilder sb = new StringBuilder();
        sb.append("Line-by-line cost:\n");
        for (LineCost lineCost : analysis.getTrace()) {
            sb.append(String.format("  line %d: %s [%s]\n", lineCost.getLine(), lineCost.getDescription(),
                    lineCost.formatCost()));
        }
        sb.append("\n");
        sb.append("T_worst(n) = ").append(analysis.getWorstCase().canonical()).append("\n");
        sb.append("T_best(n) = ").append(analysis.getBestCase().canonical()).append("\n");
        sb.append("\n");
        sb.append("Worst case: dominant term ").append(describe(worst)).append(", hence ").append(bigO).append("\n");
        sb.append("Best case: dominant term ").append(describe(best)).append(", hence ").append(bigOmega).append("\n");
        if (ComplexityResult.INDETERMINATE.equals(bigTheta)) {
            sb.append("Tight bound: ").append(ComplexityResult.INDETERMINATE)
                    .append(". The worst case grows as ").append(worst.monomial())
                    .append(" but the best case as ").append(best.monomial())
                    .append(", so the upper and lower bounds diverge.\n");
        } else {
            sb.append("Tight bound: ").append(bigTheta)
                    .append(", worst and best case share the dominant term ").append(worst.monomial()).append(".\n");
        }
        return sb.toString();
    }

    private static String describe(DominantTerm term) {
        if (term.getLeadingPart().isZero() || term.getDegree() == 0) {
            return term.monomial() + " (no dependence on n)";
        }
        return term.getLeadingPart() + " ~ " + term.monomial();
    }
}
