package com.complexity.analyzer.parser;

/*
 * Token types produced by the tokenizer. Keywords and symbols keep their text in the token,
 * the parser compares on that.
 */
public enum TokenType {
    IDENTIFIER,
    NUMBER,
    KEYWORD,
    SYMBOL,
    EOF
}
