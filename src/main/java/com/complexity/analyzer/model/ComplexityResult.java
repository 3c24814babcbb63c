package com.complexity.analyzer.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Asymptotic bounds derived for one program, with the justification and the line trace that
 * produced them. Immutable.
 */
public final class ComplexityResult {

    public static final String INDETERMINATE = "indeterminate";

    private final String bigO;
    private final String bigOmega;
    private final String bigTheta;
    private final String worstCaseFunction;
    private final String bestCaseFunction;
    private final String worstDominantTerm;
    private final String bestDominantTerm;
    private final String justification;
    private final List<LineCost> lineCosts;

    public ComplexityResult(String bigO, String bigOmega, String bigTheta,
                            String worstCaseFunction, String bestCaseFunction,
                            String worstDominantTerm, String bestDominantTerm,
                            String justification, List<LineCost> lineCosts) {
        this.bigO = Objects.requireNonNull(bigO);
        this.bigOmega = Objects.requireNonNull(bigOmega);
        this.bigTheta = Objects.requireNonNull(bigTheta);
        this.worstCaseFunction = worstCaseFunction;
        this.bestCaseFunction = bestCaseFunction;
        this.worstDominantTerm = worstDominantTerm;
        this.bestDominantTerm = bestDominantTerm;
        this.justification = Objects.requireNonNull(justification);
        this.lineCosts = List.copyOf(lineCosts);
    }

    public String getBigO() {
        return bigO;
    }

    public String getBigOmega() {
        return bigOmega;
    }

    /**
     * @return the tight bound, or {@link #INDETERMINATE} when worst and best case diverge
     */
    public String getBigTheta() {
        return bigTheta;
    }

    public boolean isTight() {
        return !INDETERMINATE.equals(bigTheta);
    }

    public Optional<String> getTightBound() {
        return isTight() ? Optional.of(bigTheta) : Optional.empty();
    }

    public String getWorstCaseFunction() {
        return worstCaseFunction;
    }

    public String getBestCaseFunction() {
        return bestCaseFunction;
    }

    public String getWorstDominantTerm() {
        return worstDominantTerm;
    }

    public String getBestDominantTerm() {
        return bestDominantTerm;
    }

    public String getJustification() {
        return justification;
    }

    public List<LineCost> getLineCosts() {
        return lineCosts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComplexityResult that = (ComplexityResult) o;
        return bigO.equals(that.bigO) && bigOmega.equals(that.bigOmega) && bigTheta.equals(that.bigTheta)
                && justification.equals(that.justification);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bigO, bigOmega, bigTheta, justification);
    }

    @Override
    public String toString() {
        return bigO + ", " + bigOmega + ", " + (isTight() ? bigTheta : "Θ " + INDETERMINATE);
    }
}
