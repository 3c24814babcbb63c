package com.complexity.analyzer.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class IfStatement extends Statement {

    private final Expression condition;
    private final Block thenBranch;
    private final Block elseBranch;

    public IfStatement(int line, int column, Expression condition, Block thenBranch, Block elseBranch) {
        super(line, column);
        this.condition = Objects.requireNonNull(condition);
        this.thenBranch = Objects.requireNonNull(thenBranch);
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Optional<Block> getElseBranch() {
        return Optional.ofNullable(elseBranch);
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }

    @Override
    public List<Node> getChildNodes() {
        List<Node> children = new ArrayList<>(List.of(condition, thenBranch));
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public String header() {
        return "if " + condition + " then";
    }

    @Override
    public String toString() {
        String result = header() + "\n" + thenBranch.indented();
        if (elseBranch != null) {
            result += "\nelse\n" + elseBranch.indented();
        }
        return result;
    }
}
