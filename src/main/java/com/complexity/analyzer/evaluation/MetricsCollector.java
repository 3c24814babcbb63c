package com.complexity.analyzer.evaluation;

import com.complexity.analyzer.model.CodeStructure;
import com.complexity.analyzer.model.ComplexityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Collects metrics over a batch of analyzed algorithms.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    // Timing metrics
    private Instant startTime;
    private Instant endTime;
    private long totalAnalysisTimeMs = 0;

    private int totalFiles = 0;
    private int analyzed = 0;
    private int failures = 0;
    private int translations = 0;
    private int indeterminate = 0;

    private final Map<String, Integer> bigODistribution = new TreeMap<>();
    private final Map<String, Integer> bigOmegaDistribution = new TreeMap<>();
    private final Map<String, Integer> bigThetaDistribution = new TreeMap<>();

    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    public void endAnalysis() {
        this.endTime = Instant.now();
        this.totalAnalysisTimeMs = startTime == null ? 0 : Duration.between(startTime, endTime).toMillis();
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    public void recordFile() {
        totalFiles++;
    }

    public void recordResult(ComplexityResult result) {
        analyzed++;
        bigODistribution.merge(result.getBigO(), 1, Integer::sum);
        bigOmegaDistribution.merge(result.getBigOmega(), 1, Integer::sum);
        bigThetaDistribution.merge(result.getBigTheta(), 1, Integer::sum);
        if (!result.isTight()) {
            indeterminate++;
        }
    }

    /**
     * Translated code only has a loop-nesting estimate of its upper bound.
     */
    public void recordTranslation(CodeStructure structure) {
        translations++;
        bigODistribution.merge(structure.getEstimatedUpperBound(), 1, Integer::sum);
    }

    public void recordFailure() {
        failures++;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getAnalyzed() {
        return analyzed;
    }

    public int getFailures() {
        return failures;
    }

    public int getTranslations() {
        return translations;
    }

    public int getIndeterminate() {
        return indeterminate;
    }

    public long getTotalAnalysisTimeMs() {
        return totalAnalysisTimeMs;
    }

    public Map<String, Integer> getBigODistribution() {
        return Collections.unmodifiableMap(bigODistribution);
    }

    public Map<String, Integer> getBigOmegaDistribution() {
        return Collections.unmodifiableMap(bigOmegaDistribution);
    }

    public Map<String, Integer> getBigThetaDistribution() {
        return Collections.unmodifiableMap(bigThetaDistribution);
    }

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(60)).append("\n");
        sb.append("COMPLEXITY ANALYSIS METRICS\n");
        sb.append("=".repeat(60)).append("\n");
        sb.append(String.format("  Total Analysis Time: %.2f seconds\n", totalAnalysisTimeMs / 1000.0));
        sb.append(String.format("  Files Processed:     %d\n", totalFiles));
        sb.append(String.format("  Analyzed:            %d\n", analyzed));
        sb.append(String.format("  Translated:          %d\n", translations));
        sb.append(String.format("  Failures:            %d\n", failures));
        sb.append(String.format("  Indeterminate Θ:     %d (%.1f%%)\n", indeterminate,
                calculatePercentage(indeterminate, analyzed)));
        appendDistribution(sb, "[UPPER BOUNDS]", bigODistribution);
        appendDistribution(sb, "[LOWER BOUNDS]", bigOmegaDistribution);
        appendDistribution(sb, "[TIGHT BOUNDS]", bigThetaDistribution);
        sb.append("=".repeat(60)).append("\n");
        return sb.toString();
    }

    private static void appendDistribution(StringBuilder sb, String title, Map<String, Integer> distribution) {
        sb.append("\n").append(title).append("\n");
        distribution.forEach((notation, count) -> sb.append(String.format("  %-20s: %,6d\n", notation, count)));
    }

    public void logReport() {
        logger.info("\n{}", getSummary());
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }
}
