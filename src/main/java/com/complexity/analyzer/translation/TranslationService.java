package com.complexity.analyzer.translation;

/**
 * Boundary to an external service that turns free-form algorithm descriptions into Java source.
 * Implementations live outside this project; they may be slow, non-deterministic and networked.
 */
@FunctionalInterface
public interface TranslationService {

    /**
     * @param pseudocode text that is not in the analyzable dialect
     * @return Java source: a compilation unit, class members or a block of statements
     * @throws TranslationException when the service cannot produce code
     */
    String translate(String pseudocode) throws TranslationException;
}
