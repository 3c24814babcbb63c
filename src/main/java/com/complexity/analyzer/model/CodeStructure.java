package com.complexity.analyzer.model;

import java.util.*;

/**
 * Structural summary of general-purpose source code obtained by translating input that was not
 * in the pseudocode dialect.
 */
public class CodeStructure {

    private final List<String> methods;
    private final List<String> loops;
    private final Set<String> calls;
    private int conditionals = 0;
    private int nodeCount = 0;
    private int maxLoopNesting = 0;
    private boolean recursive = false;

    public CodeStructure() {
        this.methods = new ArrayList<>();
        this.loops = new ArrayList<>();
        this.calls = new TreeSet<>();
    }

    public void addMethod(String name) {
        methods.add(name);
    }

    /**
     * Records a loop by kind, e.g. {@code "For"} or {@code "While"}.
     */
    public void addLoop(String kind) {
        loops.add(kind);
    }

    public void addCall(String name) {
        calls.add(name);
    }

    public void addConditional() {
        conditionals++;
    }

    public List<String> getMethods() {
        return methods;
    }

    public List<String> getLoops() {
        return loops;
    }

    /**
     * @return called names, unique and sorted
     */
    public Set<String> getCalls() {
        return calls;
    }

    public int getConditionals() {
        return conditionals;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public void setNodeCount(int nodeCount) {
        this.nodeCount = nodeCount;
    }

    public int getMaxLoopNesting() {
        return maxLoopNesting;
    }

    public void setMaxLoopNesting(int maxLoopNesting) {
        this.maxLoopNesting = maxLoopNesting;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    /**
     * Upper bound estimated from loop nesting alone. Recursion is not solved; it is flagged.
     */
    public String getEstimatedUpperBound() {
        String bound;
        if (maxLoopNesting == 0) {
            bound = "O(1)";
        } else if (maxLoopNesting == 1) {
            bound = "O(n)";
        } else {
            bound = "O(n^" + maxLoopNesting + ")";
        }
        return recursive ? bound + " (recursion not analyzed)" : bound;
    }

    @Override
    public String toString() {
        return "methods=" + methods + ", loops=" + loops + ", conditionals=" + conditionals
                + ", calls=" + calls + ", nodes=" + nodeCount + ", estimate=" + getEstimatedUpperBound();
    }
}
