package com.complexity.analyzer.parser;

/**
 * A lexical token with its position. {@code indent} is the indentation width of the line the
 * token sits on, which is what the parser uses to delimit blocks.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    private final int indent;
    private final boolean firstOnLine;

    public Token(TokenType type, String text, int line, int column, int indent, boolean firstOnLine) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.indent = indent;
        this.firstOnLine = firstOnLine;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getIndent() {
        return indent;
    }

    public boolean isFirstOnLine() {
        return firstOnLine;
    }

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    public boolean isSymbol(String symbol) {
        return is(TokenType.SYMBOL, symbol);
    }

    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
