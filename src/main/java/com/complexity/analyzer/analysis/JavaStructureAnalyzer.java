package com.complexity.analyzer.analysis;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.*;
import com.complexity.analyzer.model.CodeStructure;
import com.complexity.analyzer.translation.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Summarizes the structure of Java source produced by the translation service: declared
 * methods, loops, conditionals, calls and loop nesting.
 * <p>
 * Translators do not always return a whole compilation unit, so the source is tried as a
 * compilation unit, then as class members, then as a block of statements.
 */
public class JavaStructureAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(JavaStructureAnalyzer.class);

    private static final String WRAPPER_CLASS = "Translated";

    private final JavaParser javaParser;

    public JavaStructureAnalyzer() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
    }

    public CodeStructure analyze(String javaSource) throws TranslationException {
        CompilationUnit cu = parseLeniently(javaSource);
        CodeStructure structure = new CodeStructure();

        cu.findAll(MethodDeclaration.class).forEach(method -> {
            if (!isWrapper(method)) {
                structure.addMethod(method.getNameAsString());
            }
        });
        cu.walk(node -> {
            if (node instanceof ForStmt || node instanceof ForEachStmt) {
                structure.addLoop("For");
            } else if (node instanceof WhileStmt) {
                structure.addLoop("While");
            } else if (node instanceof DoStmt) {
                structure.addLoop("DoWhile");
            } else if (node instanceof IfStmt) {
                structure.addConditional();
            }
        });
        cu.findAll(MethodCallExpr.class).forEach(call -> structure.addCall(call.getNameAsString()));
        structure.setNodeCount(cu.findAll(Node.class).size());
        structure.setMaxLoopNesting(calculateLoopNestingRecursive(cu));
        structure.setRecursive(cu.findAll(MethodDeclaration.class).stream().anyMatch(this::hasRecursion));

        logger.debug("Translated code structure: {}", structure);
        return structure;
    }

    private CompilationUnit parseLeniently(String javaSource) throws TranslationException {
        Optional<CompilationUnit> unit = tryParse(javaSource);
        if (unit.isEmpty()) {
            unit = tryParse("class " + WRAPPER_CLASS + " {\n" + javaSource + "\n}");
        }
        if (unit.isEmpty()) {
            unit = tryParse("class " + WRAPPER_CLASS + " {\nvoid " + WRAPPER_CLASS.toLowerCase() + "() {\n"
                    + javaSource + "\n}\n}");
        }
        return unit.orElseThrow(() -> new TranslationException("Translated code is not valid Java"));
    }

    private Optional<CompilationUnit> tryParse(String source) {
        ParseResult<CompilationUnit> result = javaParser.parse(source);
        if (!result.isSuccessful()) {
            logger.debug("JavaParser rejected candidate: {}", result.getProblems());
            return Optional.empty();
        }
        return result.getResult();
    }

    private boolean isWrapper(MethodDeclaration method) {
        return method.getNameAsString().equals(WRAPPER_CLASS.toLowerCase());
    }

    private int calculateLoopNestingRecursive(Node node) {
        int maxNesting = 0;
        for (Node child : node.getChildNodes()) {
            maxNesting = Math.max(maxNesting, calculateLoopNestingRecursive(child));
        }
        boolean isLoop = node instanceof ForStmt || node instanceof WhileStmt ||
                node instanceof ForEachStmt || node instanceof DoStmt;
        return isLoop ? maxNesting + 1 : maxNesting;
    }

    private boolean hasRecursion(MethodDeclaration methodDecl) {
        String methodName = methodDecl.getNameAsString();
        return methodDecl.findAll(MethodCallExpr.class).stream()
                .anyMatch(call -> call.getNameAsString().equals(methodName));
    }
}
