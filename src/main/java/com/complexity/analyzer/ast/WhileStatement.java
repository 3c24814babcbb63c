package com.complexity.analyzer.ast;

import java.util.List;
import java.util.Objects;

public final class WhileStatement extends Statement {

    private final Expression condition;
    private final Block body;

    public WhileStatement(int line, int column, Expression condition, Block body) {
        super(line, column);
        this.condition = Objects.requireNonNull(condition);
        this.body = Objects.requireNonNull(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.WHILE;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of(condition, body);
    }

    @Override
    public String header() {
        return "while " + condition + " do";
    }

    @Override
    public String toString() {
        return header() + "\n" + body.indented();
    }
}
