package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.*;
import com.complexity.analyzer.cost.ConstantPool;
import com.complexity.analyzer.cost.CostExpression;
import com.complexity.analyzer.model.LineCost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the symbolic worst- and best-case cost functions of a program.
 * <p>
 * Every elementary statement costs a fresh constant. Sequences add up, conditionals take the
 * {@code max} (worst) or {@code min} (best) of their branches, and loops sum their body over
 * the trip count: the concrete range of a {@code for} with literal bounds, {@code n} otherwise.
 * A loop whose body can exit early runs once in the best case. A {@code while} test is charged
 * once more than the body.
 * <p>
 * The computation is a pure recursion over the tree; the only state is the constant pool of the
 * current call, so one analyzer can be used from several threads.
 */
public class CostAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CostAnalyzer.class);

    static final String THEN_TAG = "(then branch)";
    static final String ELSE_TAG = "(else branch)";
    static final String FOR_TAG = "(inside for)";
    static final String WHILE_TAG = "(inside while)";

    public CostAnalysis analyze(Program program) {
        if (program == null) {
            throw new InvalidAnalysisStateException("No syntax tree available: parse the pseudocode first");
        }
        ConstantPool constants = new ConstantPool();
        CostAnalysis result = analyzeSequence(program.getItems(), constants);
        logger.debug("Analyzed {} statements with {} constants: T_worst(n) = {}, T_best(n) = {}",
                result.getTrace().size(), constants.size(), result.getWorstCase(), result.getBestCase());
        return result;
    }

    private CostAnalysis analyzeSequence(List<Statement> statements, ConstantPool constants) {
        CostExpression worst = CostExpression.ZERO;
        CostExpression best = CostExpression.ZERO;
        List<LineCost> trace = new ArrayList<>();
        for (Statement statement : statements) {
            CostAnalysis cost = analyzeStatement(statement, constants);
            worst = worst.plus(cost.getWorstCase());
            best = best.plus(cost.getBestCase());
            trace.addAll(cost.getTrace());
        }
        return new CostAnalysis(worst, best, trace);
    }

    private CostAnalysis analyzeStatement(Statement statement, ConstantPool constants) {
        return switch (statement.getKind()) {
            case ASSIGNMENT -> elementary(statement, "Assignment", constants);
            case RETURN -> elementary(statement, "Return", constants);
            case CALL -> elementary(statement, "Call", constants);
            case BREAK -> elementary(statement, "Break", constants);
            case IF -> analyzeIf((IfStatement) statement, constants);
            case FOR -> analyzeFor((ForStatement) statement, constants);
            case WHILE -> analyzeWhile((WhileStatement) statement, constants);
            case FUNCTION -> analyzeSequence(((FunctionDeclaration) statement).getBody().getStatements(), constants);
        };
    }

    private CostAnalysis elementary(Statement statement, String label, ConstantPool constants) {
        CostExpression cost = constants.fresh();
        LineCost lineCost = new LineCost(statement.getLine(), label + ": " + statement.header(), cost);
        return new CostAnalysis(cost, cost, List.of(lineCost));
    }

    private CostAnalysis analyzeIf(IfStatement statement, ConstantPool constants) {
        CostExpression test = constants.fresh();
        List<LineCost> trace = new ArrayList<>();
        trace.add(new LineCost(statement.getLine(), "Condition test: " + statement.header(), test));

        CostAnalysis thenCost = analyzeSequence(statement.getThenBranch().getStatements(), constants);
        CostAnalysis elseCost = statement.getElseBranch()
                .map(block -> analyzeSequence(block.getStatements(), constants))
                .orElse(CostAnalysis.EMPTY);

        thenCost.getTrace().forEach(lc -> trace.add(lc.tagged(THEN_TAG)));
        elseCost.getTrace().forEach(lc -> trace.add(lc.tagged(ELSE_TAG)));

        CostExpression worst = test.plus(CostExpression.max(thenCost.getWorstCase(), elseCost.getWorstCase()));
        CostExpression best = test.plus(CostExpression.min(thenCost.getBestCase(), elseCost.getBestCase()));
        return new CostAnalysis(worst, best, trace);
    }

    private CostAnalysis analyzeFor(ForStatement statement, ConstantPool constants) {
        CostExpression overhead = constants.fresh();
        List<LineCost> trace = new ArrayList<>();
        trace.add(new LineCost(statement.getLine(), "Loop initialization and test: " + statement.header(), overhead));

        CostAnalysis body = analyzeSequence(statement.getBody().getStatements(), constants);
        body.getTrace().forEach(lc -> trace.add(lc.tagged(FOR_TAG)));

        boolean earlyExit = EarlyExitDetector.hasEarlyExit(statement.getBody());
        CostExpression trips;
        CostExpression bestTrips;
        Optional<BigInteger> concrete = statement.concreteTripCount();
        if (concrete.isPresent()) {
            BigInteger count = concrete.get();
            trips = CostExpression.number(count);
            bestTrips = earlyExit ? CostExpression.number(count.min(BigInteger.ONE)) : trips;
        } else {
            trips = CostExpression.N;
            bestTrips = earlyExit ? CostExpression.ONE : trips;
        }
        logger.debug("for loop at line {}: trip count {}, best-case trip count {}", statement.getLine(), trips, bestTrips);

        String variable = statement.getVariable();
        CostExpression worst = overhead.plus(CostExpression.sum(body.getWorstCase(), variable, CostExpression.ONE, trips));
        CostExpression best = overhead.plus(CostExpression.sum(body.getBestCase(), variable, CostExpression.ONE, bestTrips));
        return new CostAnalysis(worst, best, trace);
    }

    private CostAnalysis analyzeWhile(WhileStatement statement, ConstantPool constants) {
        CostExpression test = constants.fresh();
        CostExpression worstTrips = CostExpression.N;
        CostExpression bestTrips = EarlyExitDetector.hasEarlyExit(statement.getBody()) ? CostExpression.ONE : worstTrips;
        logger.debug("while loop at line {}: best-case trip count {}", statement.getLine(), bestTrips);

        CostExpression worstTest = CostExpression.sum(test, "i", CostExpression.ONE, worstTrips.plus(CostExpression.ONE));
        CostExpression bestTest = CostExpression.sum(test, "i", CostExpression.ONE, bestTrips.plus(CostExpression.ONE));

        List<LineCost> trace = new ArrayList<>();
        trace.add(new LineCost(statement.getLine(), "Condition test: " + statement.header(), worstTest, bestTest));

        CostAnalysis body = analyzeSequence(statement.getBody().getStatements(), constants);
        body.getTrace().forEach(lc -> trace.add(lc.tagged(WHILE_TAG)));

        CostExpression worst = worstTest.plus(CostExpression.sum(body.getWorstCase(), "j", CostExpression.ONE, worstTrips));
        CostExpression best = bestTest.plus(CostExpression.sum(body.getBestCase(), "j", CostExpression.ONE, bestTrips));
        return new CostAnalysis(worst, best, trace);
    }
}
