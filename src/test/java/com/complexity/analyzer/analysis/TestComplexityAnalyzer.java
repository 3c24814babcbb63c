package com.complexity.analyzer.analysis;

import com.complexity.analyzer.CommonTest;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.model.Algorithm;
import com.complexity.analyzer.model.ComplexityResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestComplexityAnalyzer extends CommonTest {

    @DisplayName("straight-line code is constant")
    @Test
    public void test1() {
        ComplexityResult result = analyze("a ← 1\nb ← 2\nc ← a + b");
        assertEquals("O(1)", result.getBigO());
        assertEquals("Ω(1)", result.getBigOmega());
        assertEquals("Θ(1)", result.getBigTheta());
        assertEquals(3, result.getLineCosts().size());
        assertEquals("c_1 + c_2 + c_3", result.getWorstCaseFunction());
        assertTrue(result.getJustification().contains("no dependence on n"), result.getJustification());
    }

    @DisplayName("insertion sort")
    @Test
    public void test2() {
        ComplexityResult result = analyze(INSERTION_SORT);
        assertEquals("O(n^2)", result.getBigO());
        assertEquals("Ω(n^2)", result.getBigOmega());
        assertEquals("Θ(n^2)", result.getBigTheta());
        assertTrue(result.isTight());
        assertEquals("Θ(n^2)", result.getTightBound().orElseThrow());
        assertEquals("c_4·n^2 + c_5·n^2 + c_6·n^2", result.getWorstDominantTerm());

        String justification = result.getJustification();
        assertTrue(justification.startsWith("Line-by-line cost:\n  line 1: Loop initialization and test: for j ← 2 to n do"),
                justification);
        assertTrue(justification.contains("T_worst(n) = c_4·n^2"), justification);
        assertTrue(justification.contains("Tight bound: Θ(n^2)"), justification);
    }

    @DisplayName("linear search with break: bounds diverge")
    @Test
    public void test3() {
        ComplexityResult result = analyze(LINEAR_SEARCH);
        assertEquals("O(n)", result.getBigO());
        assertEquals("Ω(1)", result.getBigOmega());
        assertEquals(ComplexityResult.INDETERMINATE, result.getBigTheta());
        assertFalse(result.isTight());
        assertTrue(result.getTightBound().isEmpty());
        assertTrue(result.getJustification().contains("diverge"));
        assertEquals("O(n), Ω(1), Θ indeterminate", result.toString());
    }

    @DisplayName("nesting depth k gives n^k")
    @Test
    public void test4() {
        ComplexityResult result = analyze("""
                for i ← 1 to n do
                    for j ← 1 to n do
                        for k ← 1 to n do
                            C[i][j] ← C[i][j] + A[i][k] * B[k][j]
                """);
        assertEquals("O(n^3)", result.getBigO());
        assertEquals("Θ(n^3)", result.getBigTheta());
    }

    @DisplayName("while with break: lower bound constant, upper bound unaffected")
    @Test
    public void test5() {
        ComplexityResult result = analyze("""
                i ← 1
                while i ≤ n do
                    if A[i] = x then
                        break
                    i ← i + 1
                """);
        assertEquals("O(n)", result.getBigO());
        assertEquals("Ω(1)", result.getBigOmega());
        assertFalse(result.isTight());
    }

    @DisplayName("break or return inside an inner loop lets the best case leave after one iteration")
    @Test
    public void test6() {
        ComplexityResult withBreak = analyze("""
                for i ← 1 to n do
                    for j ← 1 to n do
                        if A[i] = A[j] then
                            break
                """);
        assertEquals("O(n^2)", withBreak.getBigO());
        assertEquals("Ω(1)", withBreak.getBigOmega());
        assertEquals(ComplexityResult.INDETERMINATE, withBreak.getBigTheta());

        ComplexityResult withReturn = analyze("""
                for i ← 1 to n do
                    for j ← 1 to n do
                        if A[i] = A[j] then
                            return i
                """);
        assertEquals("O(n^2)", withReturn.getBigO());
        assertEquals("Ω(1)", withReturn.getBigOmega());
    }

    @DisplayName("analyzing the same tree twice gives the same result")
    @Test
    public void test7() {
        Program program = parse(INSERTION_SORT);
        ComplexityResult first = complexityAnalyzer.analyze(program);
        ComplexityResult second = complexityAnalyzer.analyze(program);
        assertEquals(first, second);
        assertEquals(first.getJustification(), second.getJustification());
    }

    @DisplayName("break in a for nested inside a while")
    @Test
    public void test8() {
        ComplexityResult result = analyze("""
                while i ≤ n do
                    for j ← 1 to n do
                        if A[j] = x then
                            break
                    i ← i + 1
                """);
        assertEquals("O(n^2)", result.getBigO());
        assertEquals("Ω(1)", result.getBigOmega());
        assertEquals(ComplexityResult.INDETERMINATE, result.getBigTheta());
    }

    @DisplayName("literal loop bounds beyond the range of a long")
    @Test
    public void test9() {
        ComplexityResult result = analyze("""
                for i ← 1 to 4294967296 do
                    for j ← 1 to 4294967296 do
                        for k ← 1 to n do
                            x ← x + 1
                """);
        assertEquals("O(n)", result.getBigO());
        assertEquals("Ω(n)", result.getBigOmega());
        assertEquals("Θ(n)", result.getBigTheta());
        assertEquals("18446744073709551616·c_4·n", result.getWorstDominantTerm());
        assertEquals("18446744073709551616·c_4·n + c_1 + 4294967296·c_2 + 18446744073709551616·c_3",
                result.getWorstCaseFunction());
    }

    @Test
    public void testUnparsedAlgorithm() {
        Algorithm algorithm = new Algorithm(1, "x ← 1");
        InvalidAnalysisStateException e = assertThrows(InvalidAnalysisStateException.class,
                () -> complexityAnalyzer.analyze(algorithm));
        assertTrue(e.getMessage().contains("Algorithm 1"));
        assertThrows(InvalidAnalysisStateException.class, () -> complexityAnalyzer.analyze((Algorithm) null));
        assertThrows(InvalidAnalysisStateException.class, () -> complexityAnalyzer.analyze((Program) null));

        algorithm.setProgram(parse(algorithm.getSourceCode()));
        assertEquals("Θ(1)", complexityAnalyzer.analyze(algorithm).getBigTheta());
    }
}
