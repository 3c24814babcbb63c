package com.complexity.analyzer;

import com.complexity.analyzer.model.Report;
import com.complexity.analyzer.processor.AnalysisProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point: derives O, Ω and Θ bounds for a pseudocode file or for every
 * pseudocode file in a directory.
 */
public class ComplexityAnalyzerApp {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzerApp.class);

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2 || (args.length == 2 && !args[1].equals("--no-metrics"))) {
            System.err.println("Usage: java -jar complexity-analyzer.jar <file-or-directory> [--no-metrics]");
            System.err.println("Example: java -jar complexity-analyzer.jar algorithms/insertion-sort.pseudo");
            System.exit(1);
        }

        String target = args[0];
        boolean collectMetrics = args.length == 1;
        logger.info("Starting complexity analyzer on {}", target);

        try {
            Path path = Paths.get(target);
            AnalysisProcessor processor = new AnalysisProcessor(collectMetrics);

            if (Files.isDirectory(path)) {
                int analyzed = processor.processDirectory(path);
                logger.info("Total files analyzed: {}", analyzed);
            } else {
                Report report = processor.analyzeFile(path);
                report.getComplexity().ifPresent(result -> {
                    System.out.println(result);
                    System.out.println();
                    System.out.println(result.getJustification());
                });
            }
        } catch (Exception e) {
            logger.error("Error analyzing {}", target, e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
