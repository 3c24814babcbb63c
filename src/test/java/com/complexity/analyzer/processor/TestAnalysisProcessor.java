package com.complexity.analyzer.processor;

import com.complexity.analyzer.CommonTest;
import com.complexity.analyzer.evaluation.MetricsCollector;
import com.complexity.analyzer.model.Algorithm;
import com.complexity.analyzer.model.CodeStructure;
import com.complexity.analyzer.model.Report;
import com.complexity.analyzer.parser.SyntaxException;
import com.complexity.analyzer.translation.TranslationException;
import com.complexity.analyzer.translation.TranslationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnalysisProcessor extends CommonTest {

    private static final String PROSE = "iterate over the list and print each item";

    private static final String TRANSLATED = """
            class Printer {
                void print(int[] items) {
                    for (int item : items) {
                        System.out.println(item);
                    }
                }
            }
            """;

    @DisplayName("analyzeSource attaches the report to a fresh algorithm")
    @Test
    public void test1() throws Exception {
        AnalysisProcessor processor = new AnalysisProcessor(false);
        Report first = processor.analyzeSource(INSERTION_SORT);
        Report second = processor.analyzeSource(LINEAR_SEARCH);

        assertEquals(1, first.getAlgorithm().getId());
        assertEquals(2, second.getAlgorithm().getId());
        assertNotEquals(first.getId(), second.getId());
        assertSame(first, first.getAlgorithm().getReport().orElseThrow());
        assertTrue(first.getAlgorithm().getProgram().isPresent());
        assertEquals(Algorithm.SourceKind.PSEUDOCODE, first.getAlgorithm().getSourceKind());
        assertEquals("Θ(n^2)", first.getComplexity().orElseThrow().getBigTheta());
        assertEquals("Algorithm 2: O(n), Ω(1), Θ indeterminate", second.summary());
        assertTrue(processor.getMetricsCollector().isEmpty());
    }

    @DisplayName("analyze reuses an existing syntax tree")
    @Test
    public void test2() throws SyntaxException {
        AnalysisProcessor processor = new AnalysisProcessor(false);
        Algorithm algorithm = new Algorithm(42, "this text is never parsed");
        algorithm.setProgram(parse("x ← 1"));
        Report report = processor.analyze(algorithm);
        assertEquals("O(1)", report.getComplexity().orElseThrow().getBigO());
    }

    @DisplayName("without a translator, prose fails with its syntax error")
    @Test
    public void test3() {
        AnalysisProcessor processor = new AnalysisProcessor(false);
        SyntaxException e = assertThrows(SyntaxException.class, () -> processor.analyzeSource(PROSE));
        assertEquals(1, e.getLine());
    }

    @DisplayName("with a translator, prose is summarized as Java")
    @Test
    public void test4() throws Exception {
        TranslationService translator = text -> TRANSLATED;
        AnalysisProcessor processor = new AnalysisProcessor(false, translator);
        Report report = processor.analyzeSource(PROSE);

        assertTrue(report.getComplexity().isEmpty());
        CodeStructure structure = report.getCodeStructure().orElseThrow();
        assertEquals("O(n)", structure.getEstimatedUpperBound());
        assertEquals(Algorithm.SourceKind.TRANSLATED, report.getAlgorithm().getSourceKind());
        assertTrue(report.summary().startsWith("Algorithm 1 (translated): methods=[print]"), report.summary());

        Report pseudo = processor.analyzeSource("x ← 1");
        assertTrue(pseudo.getComplexity().isPresent());
    }

    @DisplayName("translation failures propagate")
    @Test
    public void test5() {
        TranslationService failing = text -> {
            throw new TranslationException("service unavailable");
        };
        AnalysisProcessor processor = new AnalysisProcessor(false, failing);
        TranslationException e = assertThrows(TranslationException.class, () -> processor.analyzeSource(PROSE));
        assertEquals("service unavailable", e.getMessage());

        AnalysisProcessor blank = new AnalysisProcessor(false, text -> "  ");
        assertThrows(TranslationException.class, () -> blank.analyzeSource(PROSE));
    }

    @DisplayName("directory batch with metrics")
    @Test
    public void test6(@TempDir Path directory) throws IOException {
        Files.writeString(directory.resolve("insertion.pseudo"), INSERTION_SORT);
        Files.writeString(directory.resolve("search.txt"), LINEAR_SEARCH);
        Files.writeString(directory.resolve("broken.pseudo"), "x := 1\n");
        Files.writeString(directory.resolve("notes.md"), "not an algorithm");
        Path nested = Files.createDirectory(directory.resolve("nested"));
        Files.writeString(nested.resolve("constant.pseudo"), "a ← 1\nb ← a");

        AnalysisProcessor processor = new AnalysisProcessor(true);
        assertEquals(3, processor.processDirectory(directory));

        MetricsCollector metrics = processor.getMetricsCollector().orElseThrow();
        assertEquals(4, metrics.getTotalFiles());
        assertEquals(3, metrics.getAnalyzed());
        assertEquals(1, metrics.getFailures());
        assertEquals(1, metrics.getIndeterminate());
        assertEquals(Map.of("O(1)", 1, "O(n)", 1, "O(n^2)", 1), metrics.getBigODistribution());
        assertEquals(Map.of("Θ(1)", 1, "Θ(n^2)", 1, "indeterminate", 1), metrics.getBigThetaDistribution());
    }

    @Test
    public void testMissingDirectory(@TempDir Path directory) {
        AnalysisProcessor processor = new AnalysisProcessor(false);
        assertThrows(IOException.class, () -> processor.processDirectory(directory.resolve("absent")));
    }
}
