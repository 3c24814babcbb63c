package com.complexity.analyzer.parser;

/**
 * Thrown when pseudocode text does not match the dialect grammar.
 * Carries a best-effort 1-based position of the offending token.
 */
public class SyntaxException extends Exception {

    private final int line;
    private final int column;

    public SyntaxException(String message, int line, int column) {
        super("Syntax error at line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public SyntaxException(String message, Token token) {
        this(message, token.getLine(), token.getColumn());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
