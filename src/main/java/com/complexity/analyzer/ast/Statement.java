package com.complexity.analyzer.ast;

/**
 * A statement of the dialect. Analysis code dispatches on {@link #getKind()} with an
 * exhaustive switch.
 */
public abstract class Statement extends Node {

    public enum Kind {
        ASSIGNMENT, IF, FOR, WHILE, RETURN, CALL, BREAK, FUNCTION
    }

    protected Statement(int line, int column) {
        super(line, column);
    }

    public abstract Kind getKind();

    /**
     * Break and return leave the enclosing loop.
     */
    public boolean isEarlyExit() {
        return getKind() == Kind.BREAK || getKind() == Kind.RETURN;
    }

    public boolean isLoop() {
        return getKind() == Kind.FOR || getKind() == Kind.WHILE;
    }

    /**
     * One-line rendering; compound statements print their header only.
     */
    public abstract String header();
}
