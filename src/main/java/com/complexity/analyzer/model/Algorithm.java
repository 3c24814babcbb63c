package com.complexity.analyzer.model;

import com.complexity.analyzer.ast.Program;

import java.util.Objects;
import java.util.Optional;

/**
 * An algorithm submitted for analysis: its source text and, once parsed, its syntax tree.
 */
public class Algorithm {

    /**
     * How the source reached the analyzer.
     */
    public enum SourceKind {
        PSEUDOCODE, TRANSLATED
    }

    private final int id;
    private final String sourceCode;
    private SourceKind sourceKind = SourceKind.PSEUDOCODE;
    private Program program;
    private Report report;

    public Algorithm(int id, String sourceCode) {
        this.id = id;
        this.sourceCode = Objects.requireNonNull(sourceCode);
    }

    public int getId() {
        return id;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public void setSourceKind(SourceKind sourceKind) {
        this.sourceKind = sourceKind;
    }

    /**
     * @return the syntax tree, present only after a successful parse
     */
    public Optional<Program> getProgram() {
        return Optional.ofNullable(program);
    }

    public void setProgram(Program program) {
        this.program = program;
    }

    public Optional<Report> getReport() {
        return Optional.ofNullable(report);
    }

    public void setReport(Report report) {
        this.report = report;
    }
}
