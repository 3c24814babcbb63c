package com.complexity.analyzer.parser;

import com.complexity.analyzer.grammar.Grammar;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Turns pseudocode text into tokens using the terminal vocabulary of the {@link Grammar}.
 * <p>
 * Rules, applied at the current character:
 * <pre>
 * whitespace                 skipped; a newline starts a new line and resets the indentation
 * comment marker ("//")      skipped up to the end of the line
 * digit 0-9, or '.' + digit  NUMBER, longest match of the grammar's number pattern
 * letter or '_'              IDENTIFIER, longest match of the grammar's identifier pattern,
 *                            turned into KEYWORD when the word is a grammar keyword
 * grammar symbol             SYMBOL, longest symbol first
 * anything else              SyntaxException
 * </pre>
 * Tabs count as {@value #TAB_WIDTH} columns of indentation.
 */
public class Tokenizer {

    static final int TAB_WIDTH = 4;

    private final Grammar grammar;
    private final List<String> symbolsLongestFirst;

    public Tokenizer(Grammar grammar) {
        this.grammar = grammar;
        this.symbolsLongestFirst = new ArrayList<>(grammar.getSymbols());
        this.symbolsLongestFirst.sort(Comparator.comparingInt(String::length).reversed());
    }

    public List<Token> tokenize(String input) throws SyntaxException {
        List<Token> tokens = new ArrayList<>();
        String comment = grammar.getCommentMarker();
        int pos = 0;
        int line = 1;
        int lineStart = 0;
        int indent = 0;
        boolean atLineStart = true;

        while (pos < input.length()) {
            char c = input.charAt(pos);

            if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
                indent = 0;
                atLineStart = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (atLineStart) {
                    indent += c == '\t' ? TAB_WIDTH - indent % TAB_WIDTH : 1;
                }
                pos++;
                continue;
            }
            if (input.startsWith(comment, pos)) {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }

            boolean first = atLineStart;
            atLineStart = false;
            int column = pos - lineStart + 1;

            if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
                String number = match(grammar.getNumberPattern().matcher(input), pos);
                if (number == null) {
                    throw new SyntaxException("Malformed number", line, column);
                }
                tokens.add(new Token(TokenType.NUMBER, number, line, column, indent, first));
                pos += number.length();
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                String word = match(grammar.getIdentifierPattern().matcher(input), pos);
                if (word != null) {
                    TokenType type = grammar.isKeyword(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
                    tokens.add(new Token(type, word, line, column, indent, first));
                    pos += word.length();
                    continue;
                }
            }

            String symbol = symbolAt(input, pos);
            if (symbol == null) {
                throw new SyntaxException("Unexpected character '" + c + "'", line, column);
            }
            tokens.add(new Token(TokenType.SYMBOL, symbol, line, column, indent, first));
            pos += symbol.length();
        }

        int column = pos - lineStart + 1;
        tokens.add(new Token(TokenType.EOF, "", line, column, 0, true));
        return tokens;
    }

    // The number pattern only accepts ASCII digits.
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String match(Matcher matcher, int pos) {
        matcher.region(pos, matcher.regionEnd());
        return matcher.lookingAt() ? matcher.group() : null;
    }

    private String symbolAt(String input, int pos) {
        for (String symbol : symbolsLongestFirst) {
            if (input.startsWith(symbol, pos)) {
                return symbol;
            }
        }
        return null;
    }
}
