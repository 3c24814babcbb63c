package com.complexity.analyzer.analysis;

import com.complexity.analyzer.model.ComplexityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces worst- and best-case cost functions to O, Ω and Θ notation.
 * Θ is only reported when both cost functions have the same dominant term.
 */
public class AsymptoticDeriver {

    private static final Logger logger = LoggerFactory.getLogger(AsymptoticDeriver.class);

    private final JustificationFormatter formatter;

    public AsymptoticDeriver() {
        this(new JustificationFormatter());
    }

    public AsymptoticDeriver(JustificationFormatter formatter) {
        this.formatter = formatter;
    }

    public ComplexityResult derive(CostAnalysis analysis) {
        DominantTerm worst = DominantTerm.of(analysis.getWorstCase());
        DominantTerm best = DominantTerm.of(analysis.getBestCase());

        String bigO = "O(" + worst.monomial() + ")";
        String bigOmega = "Ω(" + best.monomial() + ")";
        String bigTheta = worst.equals(best) ? "Θ(" + worst.monomial() + ")" : ComplexityResult.INDETERMINATE;
        if (!worst.equals(best)) {
            logger.debug("Bounds diverge: worst {} vs best {}", worst, best);
        }

        String justification = formatter.format(analysis, worst, best, bigO, bigOmega, bigTheta);
        return new ComplexityResult(bigO, bigOmega, bigTheta,
                analysis.getWorstCase().canonical().toString(),
                analysis.getBestCase().canonical().toString(),
                worst.getLeadingPart().toString(),
                best.getLeadingPart().toString(),
                justification,
                analysis.getTrace());
    }
}
