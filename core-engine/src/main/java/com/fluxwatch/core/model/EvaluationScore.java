package com.fluxwatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Interval-adjusted detection quality of one run.
 *
 * <p>
 * Ratios are derived from the three counters; each ratio is {@code 0} when
 * its denominator is {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationScore implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int truePositive;
    private final int falsePositive;
    private final int falseNegative;

    public EvaluationScore(int truePositive, int falsePositive, int falseNegative) {
        if (truePositive < 0 || falsePositive < 0 || falseNegative < 0) {
            throw new IllegalArgumentException("Counts must be >= 0, got: tp=" + truePositive
                    + " fp=" + falsePositive + " fn=" + falseNegative);
        }
        this.truePositive = truePositive;
        this.falsePositive = falsePositive;
        this.falseNegative = falseNegative;
    }

    /**
     * @return a score with all counters at zero
     */
    public static EvaluationScore empty() {
        return new EvaluationScore(0, 0, 0);
    }

    /**
     * Sum the counters of two scores, e.g. to aggregate per-KPI results.
     *
     * @param other score to add; must not be {@code null}
     * @return combined score
     */
    public EvaluationScore merge(EvaluationScore other) {
        Objects.requireNonNull(other, "other must not be null");
        return new EvaluationScore(
                truePositive + other.truePositive,
                falsePositive + other.falsePositive,
                falseNegative + other.falseNegative);
    }

    public int getTruePositive() {
        return truePositive;
    }

    public int getFalsePositive() {
        return falsePositive;
    }

    public int getFalseNegative() {
        return falseNegative;
    }

    public double getPrecision() {
        return ratio(truePositive, truePositive + falsePositive);
    }

    public double getRecall() {
        return ratio(truePositive, truePositive + falseNegative);
    }

    public double getF1() {
        double precision = getPrecision();
        double recall = getRecall();
        return ratio(2 * precision * recall, precision + recall);
    }

    private static double ratio(double numerator, double denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvaluationScore that))
            return false;
        return truePositive == that.truePositive
                && falsePositive == that.falsePositive
                && falseNegative == that.falseNegative;
    }

    @Override
    public int hashCode() {
        return Objects.hash(truePositive, falsePositive, falseNegative);
    }

    @Override
    public String toString() {
        return String.format("EvaluationScore{tp=%d, fp=%d, fn=%d, precision=%.4f, recall=%.4f, f1=%.4f}",
                truePositive, falsePositive, falseNegative, getPrecision(), getRecall(), getF1());
    }
}
