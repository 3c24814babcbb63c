package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.model.Algorithm;
import com.complexity.analyzer.model.ComplexityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the complexity of a parsed program: cost analysis followed by asymptotic derivation.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final CostAnalyzer costAnalyzer;
    private final AsymptoticDeriver deriver;

    public ComplexityAnalyzer() {
        this(new CostAnalyzer(), new AsymptoticDeriver());
    }

    public ComplexityAnalyzer(CostAnalyzer costAnalyzer, AsymptoticDeriver deriver) {
        this.costAnalyzer = costAnalyzer;
        this.deriver = deriver;
    }

    /**
     * @throws InvalidAnalysisStateException when {@code program} is null
     */
    public ComplexityResult analyze(Program program) {
        ComplexityResult result = deriver.derive(costAnalyzer.analyze(program));
        logger.debug("Complexity: {}", result);
        return result;
    }

    /**
     * @throws InvalidAnalysisStateException when the algorithm has not been parsed successfully
     */
    public ComplexityResult analyze(Algorithm algorithm) {
        if (algorithm == null) {
            throw new InvalidAnalysisStateException("No algorithm to analyze");
        }
        Program program = algorithm.getProgram().orElseThrow(() -> new InvalidAnalysisStateException(
                "Algorithm " + algorithm.getId() + " has no syntax tree: parse it before analyzing"));
        return analyze(program);
    }
}
