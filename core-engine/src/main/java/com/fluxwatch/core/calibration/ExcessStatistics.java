package com.fluxwatch.core.calibration;

import java.io.Serializable;

/**
 * Running first and second moments of the threshold excesses.
 *
 * <p>
 * Folding an excess in is O(1) and the object never retains individual
 * excesses, so the tail model can be re-estimated after every new peak
 * without re-scanning history.
 * </p>
 *
 * @since 1.0.0
 */
public class ExcessStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Variances below this fraction of mean² are treated as exactly zero. */
    static final double RELATIVE_VARIANCE_FLOOR = 1e-12;

    private long count;
    private double sum;
    private double sumOfSquares;

    public ExcessStatistics() {
    }

    public ExcessStatistics(long count, double sum, double sumOfSquares) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        this.count = count;
        this.sum = sum;
        this.sumOfSquares = sumOfSquares;
    }

    /**
     * Fold one excess into the statistics.
     *
     * @param excess a strictly positive distance above the initial threshold
     */
    public void add(double excess) {
        count++;
        sum += excess;
        sumOfSquares += excess * excess;
    }

    public long getCount() {
        return count;
    }

    public double getSum() {
        return sum;
    }

    public double getSumOfSquares() {
        return sumOfSquares;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public double getMean() {
        if (count == 0) {
            throw new IllegalStateException("Mean of an empty excess set is undefined");
        }
        return sum / count;
    }

    /**
     * Population variance of the excesses, clamped to {@code 0} when rounding
     * leaves a negative or numerically negligible value.
     *
     * @return variance, never negative
     */
    public double getVariance() {
        double mean = getMean();
        double variance = sumOfSquares / count - mean * mean;
        return variance > RELATIVE_VARIANCE_FLOOR * mean * mean ? variance : 0.0;
    }

    @Override
    public String toString() {
        return "ExcessStatistics{count=" + count + ", sum=" + sum + ", sumOfSquares=" + sumOfSquares + '}';
    }
}
