package com.complexity.analyzer.ast;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base of the pseudocode syntax tree. Every node knows the 1-based line and column of the
 * token it starts with and exposes its direct children in source order.
 */
public abstract class Node {

    private final int line;
    private final int column;

    protected Node(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return direct children in source order, never null
     */
    public abstract List<Node> getChildNodes();

    /**
     * Lazy pre-order walk starting at this node. Every call to {@code iterator()} starts a new
     * walk.
     */
    public Iterable<Node> preOrder() {
        return () -> new PreOrderIterator(this);
    }

    public Stream<Node> stream() {
        return StreamSupport.stream(preOrder().spliterator(), false);
    }

    /**
     * Collects this node and all descendants of the given type, in pre-order.
     */
    public <T extends Node> List<T> findAll(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Node node : preOrder()) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    private static final class PreOrderIterator implements Iterator<Node> {
        private final Deque<Node> stack = new ArrayDeque<>();

        PreOrderIterator(Node root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Node next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node node = stack.pop();
            List<Node> children = node.getChildNodes();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            return node;
        }
    }
}
