package com.complexity.analyzer.analysis;

import com.complexity.analyzer.CommonTest;
import com.complexity.analyzer.model.LineCost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestCostAnalyzer extends CommonTest {

    private CostAnalyzer costAnalyzer;

    @BeforeEach
    public void beforeEachCostAnalyzer() {
        costAnalyzer = new CostAnalyzer();
    }

    @DisplayName("linear search: trace and cost functions")
    @Test
    public void test1() {
        CostAnalysis analysis = costAnalyzer.analyze(parse(LINEAR_SEARCH));
        List<LineCost> trace = analysis.getTrace();
        assertEquals(5, trace.size());
        assertEquals("Assignment: found ← 0", trace.get(0).getDescription());
        assertEquals("Loop initialization and test: for i ← 1 to n do", trace.get(1).getDescription());
        assertEquals("(inside for) Condition test: if A[i] = x then", trace.get(2).getDescription());
        assertEquals("(inside for) (then branch) Assignment: found ← i", trace.get(3).getDescription());
        assertEquals("(inside for) (then branch) Break: break", trace.get(4).getDescription());
        assertEquals(5, trace.get(4).getLine());

        assertEquals("c_3·n + c_4·n + c_5·n + c_1 + c_2", analysis.getWorstCase().canonical().toString());
        assertEquals("c_1 + c_2 + c_3", analysis.getBestCase().canonical().toString());
    }

    @DisplayName("insertion sort: quadratic worst and best case")
    @Test
    public void test2() {
        CostAnalysis analysis = costAnalyzer.analyze(parse(INSERTION_SORT));
        assertEquals("c_4·n^2 + c_5·n^2 + c_6·n^2 + c_2·n + c_3·n + c_4·n + c_7·n + c_1",
                analysis.getWorstCase().canonical().toString());
        assertEquals(analysis.getWorstCase(), analysis.getBestCase());
        assertEquals(7, analysis.getTrace().size());
        assertEquals("(inside for) Condition test: while i > 0 and A[i] > key do",
                analysis.getTrace().get(3).getDescription());
    }

    @DisplayName("literal bounds give a constant trip count")
    @Test
    public void test3() {
        CostAnalysis analysis = costAnalyzer.analyze(parse("for i ← 1 to 10 do\n    s ← s + i"));
        assertEquals("c_1 + 10·c_2", analysis.getWorstCase().canonical().toString());
        assertEquals(0, analysis.getWorstCase().degree());

        CostAnalysis empty = costAnalyzer.analyze(parse("for i ← 5 to 1 do\n    s ← s + i"));
        assertEquals("c_1", empty.getWorstCase().canonical().toString());
    }

    @DisplayName("conditional takes max in the worst case and min in the best case")
    @Test
    public void test4() {
        CostAnalysis analysis = costAnalyzer.analyze(parse("""
                if a > b then
                    m ← a
                else
                    m ← b
                """));
        assertEquals("c_1 + max(c_2, c_3)", analysis.getWorstCase().canonical().toString());
        assertEquals("c_1 + min(c_2, c_3)", analysis.getBestCase().canonical().toString());
        assertEquals("(else branch) Assignment: m ← b", analysis.getTrace().get(2).getDescription());

        CostAnalysis noElse = costAnalyzer.analyze(parse("if a > b then\n    m ← a"));
        assertEquals("c_1 + c_2", noElse.getWorstCase().canonical().toString());
        assertEquals("c_1", noElse.getBestCase().canonical().toString());
    }

    @DisplayName("while with break runs once in the best case")
    @Test
    public void test5() {
        CostAnalysis analysis = costAnalyzer.analyze(parse("""
                i ← 1
                while i ≤ n do
                    if A[i] = x then
                        break
                    i ← i + 1
                """));
        assertEquals(1, analysis.getWorstCase().degree());
        assertEquals(0, analysis.getBestCase().degree());
        LineCost test = analysis.getTrace().get(1);
        assertEquals("Condition test: while i ≤ n do", test.getDescription());
        assertEquals("c_2·n + c_2", test.getCost().canonical().toString());
        assertEquals("2·c_2", test.getBestCost().canonical().toString());
        assertTrue(test.formatCost().contains("best: "));
    }

    @DisplayName("function bodies are charged where they are declared")
    @Test
    public void test6() {
        CostAnalysis analysis = costAnalyzer.analyze(parse("""
                Max(a, b)
                    return a
                m ← Max(x, y)
                """));
        assertEquals(2, analysis.getTrace().size());
        assertEquals("Return: return a", analysis.getTrace().get(0).getDescription());
        assertEquals("c_1 + c_2", analysis.getWorstCase().canonical().toString());
    }

    @Test
    public void testNoProgram() {
        assertThrows(InvalidAnalysisStateException.class, () -> costAnalyzer.analyze(null));
    }
}
