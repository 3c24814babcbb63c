package com.complexity.analyzer.cost;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Canonical form of a cost expression: a sum of terms {@code k · atom · n^d} with like terms
 * collected and zero terms dropped. Immutable; equality is structural.
 */
public final class Polynomial {

    /**
     * The part of a term that like-term collection keys on: the power of {@code n} and the atom.
     */
    public static final class Term {
        private final int power;
        private final Atom atom;

        Term(int power, Atom atom) {
            this.power = power;
            this.atom = atom;
        }

        public int getPower() {
            return power;
        }

        public Atom getAtom() {
            return atom;
        }

        /**
         * Total growth degree of the term, including the growth of a max/min atom.
         */
        public int degree() {
            return power + atom.degree();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Term term = (Term) o;
            return power == term.power && atom.equals(term.atom);
        }

        @Override
        public int hashCode() {
            return Objects.hash(power, atom);
        }
    }

    private static final Comparator<Term> ORDER = Comparator.comparingInt(Term::degree).reversed()
            .thenComparing(Comparator.comparingInt(Term::getPower).reversed())
            .thenComparing(t -> t.getAtom().toString());

    public static final Polynomial ZERO = new Polynomial(new TreeMap<>(ORDER));

    private final SortedMap<Term, BigInteger> terms;

    private Polynomial(SortedMap<Term, BigInteger> terms) {
        this.terms = Collections.unmodifiableSortedMap(terms);
    }

    private static Polynomial single(int power, Atom atom, BigInteger coefficient) {
        SortedMap<Term, BigInteger> map = new TreeMap<>(ORDER);
        if (coefficient.signum() != 0) {
            map.put(new Term(power, atom), coefficient);
        }
        return new Polynomial(map);
    }

    public static Polynomial number(long value) {
        return number(BigInteger.valueOf(value));
    }

    public static Polynomial number(BigInteger value) {
        return single(0, Atom.ONE, value);
    }

    public static Polynomial constant(String name) {
        return single(0, Atom.constant(name), BigInteger.ONE);
    }

    /**
     * The problem size {@code n}.
     */
    public static Polynomial size() {
        return single(1, Atom.ONE, BigInteger.ONE);
    }

    public static Polynomial max(Polynomial a, Polynomial b) {
        if (a.isZero()) return b;
        if (b.isZero() || a.equals(b)) return a;
        if (a.isNumber() && b.isNumber()) {
            return number(a.numberValue().max(b.numberValue()));
        }
        return single(0, Atom.extremum(Atom.Kind.MAX, a, b), BigInteger.ONE);
    }

    public static Polynomial min(Polynomial a, Polynomial b) {
        if (a.isZero() || b.isZero()) return ZERO;
        if (a.equals(b)) return a;
        if (a.isNumber() && b.isNumber()) {
            return number(a.numberValue().min(b.numberValue()));
        }
        return single(0, Atom.extremum(Atom.Kind.MIN, a, b), BigInteger.ONE);
    }

    public Polynomial plus(Polynomial other) {
        SortedMap<Term, BigInteger> map = new TreeMap<>(terms);
        other.terms.forEach((term, coefficient) -> map.merge(term, coefficient, BigInteger::add));
        map.values().removeIf(coefficient -> coefficient.signum() == 0);
        return new Polynomial(map);
    }

    public Polynomial negate() {
        SortedMap<Term, BigInteger> map = new TreeMap<>(ORDER);
        terms.forEach((term, coefficient) -> map.put(term, coefficient.negate()));
        return new Polynomial(map);
    }

    public Polynomial minus(Polynomial other) {
        return plus(other.negate());
    }

    /**
     * Multiplies by a polynomial in {@code n} alone, such as a loop trip count.
     *
     * @throws IllegalArgumentException when the factor carries constants or max/min atoms
     */
    public Polynomial times(Polynomial factor) {
        if (!factor.isScalar()) {
            throw new IllegalArgumentException("Trip count must only depend on n: " + factor);
        }
        Polynomial result = ZERO;
        for (Map.Entry<Term, BigInteger> f : factor.terms.entrySet()) {
            SortedMap<Term, BigInteger> map = new TreeMap<>(ORDER);
            for (Map.Entry<Term, BigInteger> t : terms.entrySet()) {
                Term term = new Term(t.getKey().getPower() + f.getKey().getPower(), t.getKey().getAtom());
                map.merge(term, t.getValue().multiply(f.getValue()), BigInteger::add);
            }
            result = result.plus(new Polynomial(map));
        }
        return result;
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    /**
     * True when every term is a plain multiple of a power of {@code n}.
     */
    public boolean isScalar() {
        return terms.keySet().stream().allMatch(term -> term.getAtom().getKind() == Atom.Kind.ONE);
    }

    public boolean isNumber() {
        return isZero() || (isScalar() && terms.size() == 1 && terms.firstKey().getPower() == 0);
    }

    public BigInteger numberValue() {
        if (!isNumber()) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return isZero() ? BigInteger.ZERO : terms.get(terms.firstKey());
    }

    /**
     * Coefficient of the fastest-growing term; its sign tells whether a trip count is positive.
     */
    public BigInteger leadingCoefficient() {
        return isZero() ? BigInteger.ZERO : terms.get(terms.firstKey());
    }

    /**
     * Highest growth degree in {@code n} among the terms; 0 for constants and for zero.
     */
    public int degree() {
        return isZero() ? 0 : terms.firstKey().degree();
    }

    /**
     * The terms of highest growth degree.
     */
    public Polynomial leadingPart() {
        int top = degree();
        SortedMap<Term, BigInteger> map = new TreeMap<>(ORDER);
        terms.forEach((term, coefficient) -> {
            if (term.degree() == top) {
                map.put(term, coefficient);
            }
        });
        return new Polynomial(map);
    }

    public SortedMap<Term, BigInteger> getTerms() {
        return terms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return terms.equals(((Polynomial) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Term, BigInteger> entry : terms.entrySet()) {
            BigInteger coefficient = entry.getValue();
            if (sb.length() > 0) {
                sb.append(coefficient.signum() < 0 ? " - " : " + ");
            } else if (coefficient.signum() < 0) {
                sb.append("-");
            }
            sb.append(formatTerm(entry.getKey(), coefficient.abs()));
        }
        return sb.toString();
    }

    private static String formatTerm(Term term, BigInteger coefficient) {
        List<String> factors = new ArrayList<>();
        if (!coefficient.equals(BigInteger.ONE)) {
            factors.add(coefficient.toString());
        }
        if (term.getAtom().getKind() != Atom.Kind.ONE) {
            factors.add(term.getAtom().toString());
        }
        if (term.getPower() == 1) {
            factors.add("n");
        } else if (term.getPower() > 1) {
            factors.add("n^" + term.getPower());
        }
        return factors.isEmpty() ? "1" : factors.stream().collect(Collectors.joining("·"));
    }
}
