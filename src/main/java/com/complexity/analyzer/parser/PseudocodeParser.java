package com.complexity.analyzer.parser;

import com.complexity.analyzer.ast.*;
import com.complexity.analyzer.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for the pseudocode dialect described by the {@link Grammar}.
 * <p>
 * Expressions are parsed by precedence climbing over {@link Operator}. Blocks follow Cormen's
 * indentation: a block opened by {@code then}, {@code else}, {@code do} or a function header
 * holds the statements that start on the opening line, followed by those that start on lines
 * indented deeper than the line of the owning statement.
 * <p>
 * The parser keeps no state between calls; one instance can serve concurrent callers.
 */
public class PseudocodeParser {

    private static final Logger logger = LoggerFactory.getLogger(PseudocodeParser.class);

    private static final Set<String> STATEMENT_KEYWORDS = Set.of("if", "for", "while", "return", "break");

    private final Grammar grammar;
    private final Tokenizer tokenizer;

    public PseudocodeParser() {
        this(Grammar.getInstance());
    }

    public PseudocodeParser(Grammar grammar) {
        this.grammar = grammar;
        this.tokenizer = new Tokenizer(grammar);
    }

    public Grammar getGrammar() {
        return grammar;
    }

    /**
     * Checks whether the text belongs to the dialect. Error details are only logged.
     */
    public boolean validate(String text) {
        try {
            parse(text);
            return true;
        } catch (SyntaxException e) {
            logger.debug("Validation failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Parses pseudocode text into a program tree.
     *
     * @throws SyntaxException with the position of the first offending token
     */
    public Program parse(String text) throws SyntaxException {
        if (text == null) {
            throw new SyntaxException("No input", 1, 1);
        }
        Program program = new Run(tokenizer.tokenize(text)).parseProgram();
        logger.debug("Parsed program with {} top-level items", program.getItems().size());
        return program;
    }

    /**
     * Cursor over the tokens of one parse call.
     */
    private final class Run {
        private final List<Token> tokens;
        private int pos = 0;

        Run(List<Token> tokens) {
            this.tokens = tokens;
        }

        // Program -> (FunctionDeclaration | Statement)+
        Program parseProgram() throws SyntaxException {
            List<Statement> items = new ArrayList<>();
            while (peek().getType() != TokenType.EOF) {
                if (looksLikeFunctionDeclaration()) {
                    items.add(parseFunctionDeclaration());
                } else if (startsStatement(peek())) {
                    items.add(parseStatement());
                } else {
                    throw new SyntaxException("Unexpected " + peek().describe() + ", expected a statement", peek());
                }
            }
            if (items.isEmpty()) {
                throw new SyntaxException("Expected at least one statement", peek());
            }
            return new Program(items);
        }

        /*
         * NAME '(' [IDENT (',' IDENT)*] ')' followed by a block start. Decided by looking ahead
         * and rewinding, so that a call statement with the same prefix is still parsed as a call.
         */
        private boolean looksLikeFunctionDeclaration() {
            int mark = pos;
            try {
                Token name = next();
                if (name.getType() != TokenType.IDENTIFIER || !next().isSymbol("(")) {
                    return false;
                }
                if (!peek().isSymbol(")")) {
                    do {
                        if (next().getType() != TokenType.IDENTIFIER) {
                            return false;
                        }
                    } while (accept(TokenType.SYMBOL, ","));
                }
                Token close = next();
                if (!close.isSymbol(")")) {
                    return false;
                }
                return opensBlock(peek(), name, close);
            } finally {
                pos = mark;
            }
        }

        private FunctionDeclaration parseFunctionDeclaration() throws SyntaxException {
            Token name = expect(TokenType.IDENTIFIER, "function name");
            expectSymbol("(");
            List<String> parameters = new ArrayList<>();
            if (!peek().isSymbol(")")) {
                do {
                    parameters.add(expect(TokenType.IDENTIFIER, "parameter name").getText());
                } while (accept(TokenType.SYMBOL, ","));
            }
            Token close = expectSymbol(")");
            Block body = parseBlock(name, close);
            logger.debug("Function {} declared at line {}", name.getText(), name.getLine());
            return new FunctionDeclaration(name.getLine(), name.getColumn(), name.getText(), parameters, body);
        }

        // Statement -> If | For | While | Return | Break | Call | Assignment
        private Statement parseStatement() throws SyntaxException {
            Token start = peek();
            if (start.getType() == TokenType.KEYWORD) {
                return switch (start.getText()) {
                    case "if" -> parseIf();
                    case "for" -> parseFor();
                    case "while" -> parseWhile();
                    case "return" -> parseReturn();
                    case "break" -> new BreakStatement(next().getLine(), start.getColumn());
                    default -> throw new SyntaxException("Unexpected keyword '" + start.getText() + "'", start);
                };
            }
            if (start.getType() != TokenType.IDENTIFIER) {
                throw new SyntaxException("Unexpected " + start.describe() + ", expected a statement", start);
            }
            if (peekAt(1).isSymbol("(")) {
                return new CallStatement(parseCall());
            }
            VariableExpression target = parseVariable();
            Token arrow = peek();
            if (!arrow.isSymbol(grammar.getAssignmentOperator())) {
                throw new SyntaxException("Expected '" + grammar.getAssignmentOperator() + "' after " + target
                        + " but found " + arrow.describe(), arrow);
            }
            next();
            return new AssignmentStatement(target, parseExpression());
        }

        // Return -> 'return' Expr
        private ReturnStatement parseReturn() throws SyntaxException {
            Token returnToken = expectKeyword("return");
            return new ReturnStatement(returnToken.getLine(), returnToken.getColumn(), parseExpression());
        }

        // If -> 'if' Expr 'then' Block ('else' Block)?
        private IfStatement parseIf() throws SyntaxException {
            Token ifToken = expectKeyword("if");
            Expression condition = parseExpression();
            Token then = expectKeyword("then");
            Block thenBranch = parseBlock(ifToken, then);
            Block elseBranch = null;
            Token elseToken = peek();
            if (elseToken.isKeyword("else") && ownsElse(ifToken, elseToken)) {
                next();
                elseBranch = parseBlock(ifToken, elseToken);
            }
            return new IfStatement(ifToken.getLine(), ifToken.getColumn(), condition, thenBranch, elseBranch);
        }

        private boolean ownsElse(Token ifToken, Token elseToken) {
            if (elseToken.getLine() == ifToken.getLine()) {
                return true;
            }
            return elseToken.isFirstOnLine() && elseToken.getIndent() == ifToken.getIndent();
        }

        // For -> 'for' IDENT '←' Expr ('to' | 'downto') Expr 'do' Block
        private ForStatement parseFor() throws SyntaxException {
            Token forToken = expectKeyword("for");
            Token variable = expect(TokenType.IDENTIFIER, "loop variable");
            expectSymbol(grammar.getAssignmentOperator());
            Expression from = parseExpression();
            ForStatement.Direction direction;
            if (accept(TokenType.KEYWORD, "to")) {
                direction = ForStatement.Direction.TO;
            } else if (accept(TokenType.KEYWORD, "downto")) {
                direction = ForStatement.Direction.DOWNTO;
            } else {
                throw new SyntaxException("Expected 'to' or 'downto' but found " + peek().describe(), peek());
            }
            Expression to = parseExpression();
            Token doToken = expectKeyword("do");
            Block body = parseBlock(forToken, doToken);
            return new ForStatement(forToken.getLine(), forToken.getColumn(), variable.getText(), from, direction, to, body);
        }

        // While -> 'while' Expr 'do' Block
        private WhileStatement parseWhile() throws SyntaxException {
            Token whileToken = expectKeyword("while");
            Expression condition = parseExpression();
            Token doToken = expectKeyword("do");
            return new WhileStatement(whileToken.getLine(), whileToken.getColumn(), condition, parseBlock(whileToken, doToken));
        }

        private Block parseBlock(Token owner, Token opener) throws SyntaxException {
            List<Statement> statements = new ArrayList<>();
            while (opensBlock(peek(), owner, opener)) {
                statements.add(parseStatement());
            }
            if (statements.isEmpty()) {
                throw new SyntaxException("Expected an indented statement after '" + opener.getText()
                        + "' but found " + peek().describe(), peek());
            }
            return new Block(statements);
        }

        private boolean opensBlock(Token token, Token owner, Token opener) {
            if (!startsStatement(token)) {
                return false;
            }
            return token.getLine() == opener.getLine() || token.getIndent() > owner.getIndent();
        }

        private boolean startsStatement(Token token) {
            return token.getType() == TokenType.IDENTIFIER
                    || (token.getType() == TokenType.KEYWORD && STATEMENT_KEYWORDS.contains(token.getText()));
        }

        // MARK: expressions

        Expression parseExpression() throws SyntaxException {
            return parseBinary(Operator.OR.getPrecedence());
        }

        private Expression parseBinary(int minPrecedence) throws SyntaxException {
            Expression left = parseUnary(minPrecedence);
            while (true) {
                Optional<Operator> operator = binaryOperator(peek());
                if (operator.isEmpty() || operator.get().getPrecedence() < minPrecedence) {
                    return left;
                }
                next();
                Expression right = parseBinary(operator.get().getPrecedence() + 1);
                left = new BinaryExpression(operator.get(), left, right);
            }
        }

        private Expression parseUnary(int minPrecedence) throws SyntaxException {
            Token token = peek();
            if (token.isKeyword("not")) {
                if (minPrecedence > Operator.NOT.getPrecedence()) {
                    throw new SyntaxException("'not' must be parenthesized here", token);
                }
                next();
                return new UnaryExpression(token.getLine(), token.getColumn(), Operator.NOT,
                        parseBinary(Operator.NOT.getPrecedence()));
            }
            return parseFactor();
        }

        // Factor -> ('+' | '-') Factor | Atom
        private Expression parseFactor() throws SyntaxException {
            Token token = peek();
            if (token.isSymbol("+") || token.isSymbol("-")) {
                next();
                Operator sign = token.isSymbol("+") ? Operator.PLUS : Operator.MINUS;
                return new UnaryExpression(token.getLine(), token.getColumn(), sign, parseFactor());
            }
            return parseAtom();
        }

        // Atom -> NUMBER | '(' Expr ')' | Call | Variable
        private Expression parseAtom() throws SyntaxException {
            Token token = peek();
            if (token.getType() == TokenType.NUMBER) {
                next();
                return new LiteralExpression(token.getLine(), token.getColumn(), token.getText());
            }
            if (token.getType() == TokenType.IDENTIFIER) {
                return peekAt(1).isSymbol("(") ? parseCall() : parseVariable();
            }
            if (token.isSymbol("(")) {
                next();
                Expression inner = parseExpression();
                expectSymbol(")");
                return inner;
            }
            throw new SyntaxException("Expected an expression but found " + token.describe(), token);
        }

        private CallExpression parseCall() throws SyntaxException {
            Token name = expect(TokenType.IDENTIFIER, "function name");
            expectSymbol("(");
            List<Expression> arguments = new ArrayList<>();
            if (!peek().isSymbol(")")) {
                do {
                    arguments.add(parseExpression());
                } while (accept(TokenType.SYMBOL, ","));
            }
            expectSymbol(")");
            return new CallExpression(name.getLine(), name.getColumn(), name.getText(), arguments);
        }

        // Variable -> IDENT ('.' IDENT | '[' Expr ']')*
        private VariableExpression parseVariable() throws SyntaxException {
            Token name = expect(TokenType.IDENTIFIER, "variable name");
            List<VariableExpression.Accessor> accessors = new ArrayList<>();
            while (true) {
                if (accept(TokenType.SYMBOL, ".")) {
                    accessors.add(VariableExpression.Accessor.field(expect(TokenType.IDENTIFIER, "field name").getText()));
                } else if (accept(TokenType.SYMBOL, "[")) {
                    accessors.add(VariableExpression.Accessor.index(parseExpression()));
                    expectSymbol("]");
                } else {
                    return new VariableExpression(name.getLine(), name.getColumn(), name.getText(), accessors);
                }
            }
        }

        private Optional<Operator> binaryOperator(Token token) {
            if (token.getType() != TokenType.SYMBOL && token.getType() != TokenType.KEYWORD) {
                return Optional.empty();
            }
            return Operator.fromSymbol(token.getText()).filter(op -> op != Operator.NOT);
        }

        // MARK: token helpers

        private Token peek() {
            return peekAt(0);
        }

        private Token peekAt(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private Token next() {
            Token token = peek();
            if (pos < tokens.size() - 1) {
                pos++;
            }
            return token;
        }

        private boolean accept(TokenType type, String text) {
            if (peek().is(type, text)) {
                next();
                return true;
            }
            return false;
        }

        private Token expect(TokenType type, String what) throws SyntaxException {
            Token token = peek();
            if (token.getType() != type) {
                throw new SyntaxException("Expected " + what + " but found " + token.describe(), token);
            }
            return next();
        }

        private Token expectKeyword(String keyword) throws SyntaxException {
            return expectText(TokenType.KEYWORD, keyword);
        }

        private Token expectSymbol(String symbol) throws SyntaxException {
            return expectText(TokenType.SYMBOL, symbol);
        }

        private Token expectText(TokenType type, String text) throws SyntaxException {
            Token token = peek();
            if (!token.is(type, text)) {
                throw new SyntaxException("Expected '" + text + "' but found " + token.describe(), token);
            }
            return next();
        }
    }
}
