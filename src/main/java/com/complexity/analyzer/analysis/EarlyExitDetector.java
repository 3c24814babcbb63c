package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Block;
import com.complexity.analyzer.ast.ForStatement;
import com.complexity.analyzer.ast.IfStatement;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.ast.WhileStatement;

import java.util.List;

/**
 * Finds a {@code break} or {@code return} anywhere in a loop body, nested loops and branches
 * included. Function declarations are never entered. Being reachable is enough: an exit
 * guarded by an {@code if} counts.
 */
public final class EarlyExitDetector {

    private EarlyExitDetector() {
    }

    public static boolean hasEarlyExit(Block loopBody) {
        return scan(loopBody.getStatements());
    }

    private static boolean scan(List<Statement> statements) {
        return statements.stream().anyMatch(EarlyExitDetector::exits);
    }

    private static boolean exits(Statement statement) {
        return switch (statement.getKind()) {
            case BREAK, RETURN -> true;
            case IF -> {
                IfStatement ifStatement = (IfStatement) statement;
                yield scan(ifStatement.getThenBranch().getStatements())
                        || ifStatement.getElseBranch().map(b -> scan(b.getStatements())).orElse(false);
            }
            case FOR -> scan(((ForStatement) statement).getBody().getStatements());
            case WHILE -> scan(((WhileStatement) statement).getBody().getStatements());
            case ASSIGNMENT, CALL, FUNCTION -> false;
        };
    }
}
