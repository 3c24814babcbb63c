package com.complexity.analyzer.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formal description of the Cormen-style pseudocode dialect.
 * <p>
 * The EBNF text is loaded once from {@code grammar/pseudocode.ebnf}. Besides rule lookup, the
 * grammar derives the terminal vocabulary used by the tokenizer: the keywords and punctuation
 * quoted in the productions, the assignment operator and the relational operators.
 * Instances are immutable and shared by every parser in the process.
 */
public final class Grammar {

    private static final Logger logger = LoggerFactory.getLogger(Grammar.class);

    public static final String RESOURCE = "grammar/pseudocode.ebnf";

    public static final String ASSIGNMENT_RULE = "ASSIGN_OP";
    public static final String RELATIONAL_RULE = "REL_OP";
    public static final String COMMENT_RULE = "COMMENT";
    public static final String IDENTIFIER_RULE = "IDENTIFIER";
    public static final String NUMBER_RULE = "NUMBER";

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern REGEX = Pattern.compile("/(.+)/");

    private static final Grammar INSTANCE = load();

    private final String text;
    private final Map<String, String> rules;
    private final Set<String> keywords;
    private final Set<String> symbols;
    private final List<String> relationalOperators;
    private final String assignmentOperator;
    private final String commentMarker;
    private final Pattern identifierPattern;
    private final Pattern numberPattern;

    Grammar(String text) {
        this.text = text;
        this.rules = Collections.unmodifiableMap(parseRules(text));
        this.relationalOperators = List.copyOf(quotedIn(requireRule(RELATIONAL_RULE)));
        this.assignmentOperator = quotedIn(requireRule(ASSIGNMENT_RULE)).get(0);
        this.commentMarker = quotedIn(requireRule(COMMENT_RULE)).get(0);
        this.identifierPattern = regexIn(requireRule(IDENTIFIER_RULE));
        this.numberPattern = regexIn(requireRule(NUMBER_RULE));

        Set<String> words = new TreeSet<>();
        Set<String> punctuation = new TreeSet<>();
        for (Map.Entry<String, String> entry : rules.entrySet()) {
            if (entry.getKey().equals(COMMENT_RULE)) {
                continue;
            }
            for (String terminal : quotedIn(entry.getValue())) {
                if (Character.isLetter(terminal.charAt(0))) {
                    words.add(terminal);
                } else {
                    punctuation.add(terminal);
                }
            }
        }
        this.keywords = Collections.unmodifiableSet(words);
        this.symbols = Collections.unmodifiableSet(punctuation);
    }

    /**
     * @return the process-wide grammar
     */
    public static Grammar getInstance() {
        return INSTANCE;
    }

    private static Grammar load() {
        try (InputStream in = Grammar.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Grammar resource not found: " + RESOURCE);
            }
            Grammar grammar = new Grammar(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            logger.debug("Loaded grammar with {} rules and keywords {}", grammar.rules.size(), grammar.keywords);
            return grammar;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read grammar resource " + RESOURCE, e);
        }
    }

    /**
     * Splits the EBNF into named productions. Continuation lines starting with {@code |}
     * belong to the preceding rule; directives and comment lines are skipped.
     */
    private static Map<String, String> parseRules(String text) {
        Map<String, String> result = new LinkedHashMap<>();
        String current = null;
        for (String raw : text.split("\n")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("%") || line.startsWith("//")) {
                continue;
            }
            if (line.startsWith("|") && current != null) {
                result.put(current, result.get(current) + " " + line);
                continue;
            }
            int colon = line.indexOf(':');
            if (colon > 0) {
                current = line.substring(0, colon).strip().replace("?", "");
                result.put(current, line.substring(colon + 1).strip());
            }
        }
        return result;
    }

    private static List<String> quotedIn(String production) {
        List<String> result = new ArrayList<>();
        Matcher matcher = QUOTED.matcher(production);
        while (matcher.find()) {
            result.add(matcher.group(1));
        }
        return result;
    }

    private static Pattern regexIn(String production) {
        Matcher matcher = REGEX.matcher(production);
        if (!matcher.find()) {
            throw new IllegalStateException("Terminal has no regular expression: " + production);
        }
        return Pattern.compile(matcher.group(1));
    }

    private String requireRule(String name) {
        String production = rules.get(name);
        if (production == null) {
            throw new IllegalStateException("Grammar lacks rule " + name);
        }
        return production;
    }

    /**
     * Looks up a production by name, e.g. {@code "for_statement"} or {@code "REL_OP"}.
     */
    public Optional<String> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /**
     * @return every production in declaration order
     */
    public Map<String, String> allRules() {
        return rules;
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    public boolean isKeyword(String word) {
        return keywords.contains(word);
    }

    /**
     * Punctuation and operator terminals, including the assignment and relational operators.
     */
    public Set<String> getSymbols() {
        return symbols;
    }

    public List<String> getRelationalOperators() {
        return relationalOperators;
    }

    public String getAssignmentOperator() {
        return assignmentOperator;
    }

    public String getCommentMarker() {
        return commentMarker;
    }

    public Pattern getIdentifierPattern() {
        return identifierPattern;
    }

    public Pattern getNumberPattern() {
        return numberPattern;
    }

    public String getText() {
        return text;
    }
}
