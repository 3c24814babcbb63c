package com.complexity.analyzer.processor;

import com.complexity.analyzer.analysis.ComplexityAnalyzer;
import com.complexity.analyzer.analysis.JavaStructureAnalyzer;
import com.complexity.analyzer.evaluation.MetricsCollector;
import com.complexity.analyzer.model.Algorithm;
import com.complexity.analyzer.model.CodeStructure;
import com.complexity.analyzer.model.ComplexityResult;
import com.complexity.analyzer.model.Report;
import com.complexity.analyzer.parser.PseudocodeParser;
import com.complexity.analyzer.parser.SyntaxException;
import com.complexity.analyzer.translation.TranslationException;
import com.complexity.analyzer.translation.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs algorithms through parsing, cost analysis and asymptotic derivation, one at a time or
 * for a whole directory of pseudocode files.
 */
public class AnalysisProcessor {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisProcessor.class);

    private final PseudocodeParser parser;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final JavaStructureAnalyzer structureAnalyzer;
    private final TranslationService translationService;
    private final MetricsCollector metricsCollector;
    private final boolean collectMetrics;

    private final AtomicInteger algorithmIds = new AtomicInteger(0);
    private final AtomicInteger reportIds = new AtomicInteger(0);

    public AnalysisProcessor() {
        this(true);
    }

    public AnalysisProcessor(boolean collectMetrics) {
        this(collectMetrics, null);
    }

    /**
     * @param translationService used for input outside the pseudocode dialect; may be null, in
     *                           which case such input fails with its syntax error
     */
    public AnalysisProcessor(boolean collectMetrics, TranslationService translationService) {
        this.parser = new PseudocodeParser();
        this.complexityAnalyzer = new ComplexityAnalyzer();
        this.structureAnalyzer = new JavaStructureAnalyzer();
        this.translationService = translationService;
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new MetricsCollector() : null;
    }

    /**
     * Parses the algorithm unless it already carries a syntax tree, then derives its complexity.
     * The returned report is also attached to the algorithm.
     */
    public Report analyze(Algorithm algorithm) throws SyntaxException {
        if (algorithm.getProgram().isEmpty()) {
            algorithm.setProgram(parser.parse(algorithm.getSourceCode()));
        }
        ComplexityResult result = complexityAnalyzer.analyze(algorithm);
        Report report = new Report(reportIds.incrementAndGet(), algorithm, result);
        logger.debug("{}", report.summary());
        return report;
    }

    /**
     * Analyzes free text. Text outside the pseudocode dialect is handed to the translation
     * service, when one is configured, and the translated code is summarized instead.
     */
    public Report analyzeSource(String sourceCode) throws SyntaxException, TranslationException {
        Algorithm algorithm = new Algorithm(algorithmIds.incrementAndGet(), sourceCode);
        try {
            return analyze(algorithm);
        } catch (SyntaxException e) {
            if (translationService == null) {
                throw e;
            }
            logger.info("Algorithm {} is not in the pseudocode dialect ({}), translating", algorithm.getId(),
                    e.getMessage());
            return analyzeTranslated(algorithm);
        }
    }

    private Report analyzeTranslated(Algorithm algorithm) throws TranslationException {
        String javaSource = translationService.translate(algorithm.getSourceCode());
        if (javaSource == null || javaSource.isBlank()) {
            throw new TranslationException("Translation of algorithm " + algorithm.getId() + " returned no code");
        }
        algorithm.setSourceKind(Algorithm.SourceKind.TRANSLATED);
        CodeStructure structure = structureAnalyzer.analyze(javaSource);
        return new Report(reportIds.incrementAndGet(), algorithm, structure);
    }

    public Report analyzeFile(Path file) throws IOException, SyntaxException, TranslationException {
        return analyzeSource(Files.readString(file));
    }

    /**
     * Analyzes every {@code .pseudo} and {@code .txt} file below the given directory. A file
     * that fails is logged and counted; it does not stop the batch.
     *
     * @return the number of files analyzed successfully
     * @throws IOException when the directory cannot be walked
     */
    public int processDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            throw new IOException("Path does not exist: " + directory);
        }
        if (collectMetrics) {
            metricsCollector.startAnalysis();
        }

        List<Path> files;
        try (Stream<Path> paths = Files.walk(directory)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(AnalysisProcessor::isAlgorithmFile)
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        logger.info("Found {} algorithm files in {}", files.size(), directory);

        AtomicInteger processedCount = new AtomicInteger(0);
        for (Path file : files) {
            if (collectMetrics) {
                metricsCollector.recordFile();
            }
            try {
                Report report = analyzeFile(file);
                logger.info("{}: {}", file.getFileName(), report.summary());
                if (collectMetrics) {
                    report.getComplexity().ifPresent(metricsCollector::recordResult);
                    report.getCodeStructure().ifPresent(metricsCollector::recordTranslation);
                }
                processedCount.incrementAndGet();
            } catch (SyntaxException | TranslationException e) {
                logger.warn("Skipping {}: {}", file, e.getMessage());
                recordFailure();
            } catch (Exception e) {
                logger.error("Error analyzing file: {}", file, e);
                recordFailure();
            }
        }

        if (collectMetrics) {
            metricsCollector.endAnalysis();
            metricsCollector.logReport();
        }
        return processedCount.get();
    }

    private void recordFailure() {
        if (collectMetrics) {
            metricsCollector.recordFailure();
        }
    }

    private static boolean isAlgorithmFile(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".pseudo") || name.endsWith(".txt");
    }

    public Optional<MetricsCollector> getMetricsCollector() {
        return Optional.ofNullable(metricsCollector);
    }
}
