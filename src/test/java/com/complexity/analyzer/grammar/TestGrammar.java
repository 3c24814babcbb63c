package com.complexity.analyzer.grammar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestGrammar {

    @DisplayName("terminals come from the grammar resource")
    @Test
    public void test1() {
        Grammar grammar = Grammar.getInstance();
        assertSame(grammar, Grammar.getInstance());
        assertEquals("←", grammar.getAssignmentOperator());
        assertEquals(List.of("≤", "≥", "≠", "=", "<", ">"), grammar.getRelationalOperators());
        assertEquals("//", grammar.getCommentMarker());

        assertTrue(grammar.isKeyword("if"));
        assertTrue(grammar.isKeyword("downto"));
        assertTrue(grammar.isKeyword("mod"));
        assertTrue(grammar.isKeyword("break"));
        assertFalse(grammar.isKeyword("n"));

        assertTrue(grammar.getSymbols().contains("←"));
        assertTrue(grammar.getSymbols().contains("["));
        assertFalse(grammar.getSymbols().contains("//"));
        assertFalse(grammar.getSymbols().contains(":="));
    }

    @DisplayName("rule lookup")
    @Test
    public void test2() {
        Grammar grammar = Grammar.getInstance();
        assertEquals("start", grammar.allRules().keySet().iterator().next());
        String forRule = grammar.rule("for_statement").orElseThrow();
        assertTrue(forRule.contains("\"downto\""), forRule);
        assertTrue(grammar.rule("statement").orElseThrow().contains("break_statement"));
        assertTrue(grammar.rule("no_such_rule").isEmpty());
        assertTrue(grammar.getText().contains("%ignore COMMENT"));
    }

    @Test
    public void testPatterns() {
        Grammar grammar = Grammar.getInstance();
        assertTrue(grammar.getIdentifierPattern().matcher("j-1").matches());
        assertTrue(grammar.getIdentifierPattern().matcher("_tmp2").matches());
        assertFalse(grammar.getIdentifierPattern().matcher("2x").matches());
        assertTrue(grammar.getNumberPattern().matcher("3.5e2").matches());
        assertTrue(grammar.getNumberPattern().matcher(".5").matches());
    }

    @Test
    public void testIncompleteGrammar() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new Grammar("start: statement+\n"));
        assertEquals("Grammar lacks rule REL_OP", e.getMessage());
    }
}
