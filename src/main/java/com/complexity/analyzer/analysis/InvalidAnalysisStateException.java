package com.complexity.analyzer.analysis;

/**
 * Thrown when an analysis is requested without a successfully parsed program.
 */
public class InvalidAnalysisStateException extends IllegalStateException {

    public InvalidAnalysisStateException(String message) {
        super(message);
    }
}
