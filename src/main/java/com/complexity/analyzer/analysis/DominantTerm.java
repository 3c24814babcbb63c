package com.complexity.analyzer.analysis;

import com.complexity.analyzer.cost.CostExpression;
import com.complexity.analyzer.cost.Polynomial;

import java.util.Objects;

/**
 * Fastest-growing part of a cost function. Two dominant terms are equal when they grow with the
 * same power of {@code n}; constant factors are ignored.
 */
public final class DominantTerm {

    private final int degree;
    private final Polynomial leadingPart;

    private DominantTerm(int degree, Polynomial leadingPart) {
        this.degree = degree;
        this.leadingPart = leadingPart;
    }

    public static DominantTerm of(CostExpression cost) {
        Polynomial canonical = cost.canonical();
        return new DominantTerm(canonical.degree(), canonical.leadingPart());
    }

    public int getDegree() {
        return degree;
    }

    /**
     * The leading terms with their symbolic coefficients, e.g. {@code c_4·n^2 + c_5·n^2}.
     */
    public Polynomial getLeadingPart() {
        return leadingPart;
    }

    /**
     * Monomial used inside the notation: {@code 1}, {@code n} or {@code n^k}.
     */
    public String monomial() {
        if (degree == 0) {
            return "1";
        }
        return degree == 1 ? "n" : "n^" + degree;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return degree == ((DominantTerm) o).degree;
    }

    @Override
    public int hashCode() {
        return Objects.hash(degree);
    }

    @Override
    public String toString() {
        return monomial();
    }
}
