package com.complexity.analyzer.cost;

import java.util.Objects;

/**
 * The non-numeric factor of a polynomial term: the unit, an opaque positive constant
 * {@code c_i}, or a symbolic {@code max}/{@code min} of two polynomials.
 */
public final class Atom {

    public enum Kind {
        ONE, CONSTANT, MAX, MIN
    }

    public static final Atom ONE = new Atom(Kind.ONE, null, null, null);

    private final Kind kind;
    private final String name;
    private final Polynomial left;
    private final Polynomial right;

    private Atom(Kind kind, String name, Polynomial left, Polynomial right) {
        this.kind = kind;
        this.name = name;
        this.left = left;
        this.right = right;
    }

    public static Atom constant(String name) {
        return new Atom(Kind.CONSTANT, Objects.requireNonNull(name), null, null);
    }

    /**
     * Operands are stored in a fixed order so that {@code max(a, b)} equals {@code max(b, a)}.
     */
    static Atom extremum(Kind kind, Polynomial a, Polynomial b) {
        if (kind != Kind.MAX && kind != Kind.MIN) {
            throw new IllegalArgumentException("Not an extremum: " + kind);
        }
        boolean swap = a.toString().compareTo(b.toString()) > 0;
        return new Atom(kind, null, swap ? b : a, swap ? a : b);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public Polynomial getLeft() {
        return left;
    }

    public Polynomial getRight() {
        return right;
    }

    /**
     * Growth degree in {@code n}: a maximum grows like its faster operand, a minimum like its
     * slower one.
     */
    public int degree() {
        return switch (kind) {
            case MAX -> Math.max(left.degree(), right.degree());
            case MIN -> Math.min(left.degree(), right.degree());
            case ONE, CONSTANT -> 0;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Atom atom = (Atom) o;
        return kind == atom.kind && Objects.equals(name, atom.name)
                && Objects.equals(left, atom.left) && Objects.equals(right, atom.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, left, right);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ONE -> "1";
            case CONSTANT -> name;
            case MAX -> "max(" + left + ", " + right + ")";
            case MIN -> "min(" + left + ", " + right + ")";
        };
    }
}
