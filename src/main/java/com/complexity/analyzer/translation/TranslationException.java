package com.complexity.analyzer.translation;

/**
 * Failure of the external translation service, or translated code that cannot be read.
 * Kept apart from {@link com.complexity.analyzer.parser.SyntaxException}, which reports errors in
 * the pseudocode itself.
 */
public class TranslationException extends Exception {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
