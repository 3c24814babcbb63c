package com.complexity.analyzer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of analyzing one {@link Algorithm}. A report holds a complexity result when the
 * source was in the dialect, or a structure summary of the translated code otherwise.
 */
public class Report {

    private final int id;
    private final Algorithm algorithm;
    private final ComplexityResult complexity;
    private final CodeStructure codeStructure;

    public Report(int id, Algorithm algorithm, ComplexityResult complexity) {
        this(id, algorithm, Objects.requireNonNull(complexity), null);
    }

    public Report(int id, Algorithm algorithm, CodeStructure codeStructure) {
        this(id, algorithm, null, Objects.requireNonNull(codeStructure));
    }

    private Report(int id, Algorithm algorithm, ComplexityResult complexity, CodeStructure codeStructure) {
        this.id = id;
        this.algorithm = Objects.requireNonNull(algorithm);
        this.complexity = complexity;
        this.codeStructure = codeStructure;
        algorithm.setReport(this);
    }

    public int getId() {
        return id;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public Optional<ComplexityResult> getComplexity() {
        return Optional.ofNullable(complexity);
    }

    public Optional<CodeStructure> getCodeStructure() {
        return Optional.ofNullable(codeStructure);
    }

    public String summary() {
        if (complexity != null) {
            return "Algorithm " + algorithm.getId() + ": " + complexity;
        }
        return "Algorithm " + algorithm.getId() + " (translated): " + codeStructure;
    }
}
