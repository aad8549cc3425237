package com.fluxwatch.core.calibration;

import java.util.Arrays;
import java.util.Objects;

/**
 * Empirical quantiles by linear interpolation between order statistics.
 *
 * <p>
 * For {@code n} sorted values the {@code q}-quantile sits at position
 * {@code q * (n - 1)}; e.g. the 0.8-quantile of {@code [1,1,1,1,1,10]} is
 * {@code 1}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EmpiricalQuantile {

    private EmpiricalQuantile() {
        // utility class
    }

    /**
     * Compute the {@code q}-quantile of unsorted values. The input is not
     * modified.
     *
     * @param values non-empty sample
     * @param q      quantile level in [0, 1]
     * @return the interpolated quantile
     * @throws IllegalArgumentException if {@code values} is empty or {@code q}
     *                                  is outside [0, 1]
     */
    public static double of(double[] values, double q) {
        Objects.requireNonNull(values, "values must not be null");
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return ofSorted(sorted, q);
    }

    /**
     * Same as {@link #of(double[], double)} for an already sorted array.
     */
    public static double ofSorted(double[] sorted, double q) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("Quantile of an empty sample is undefined");
        }
        if (!(q >= 0 && q <= 1)) {
            throw new IllegalArgumentException("Quantile level must be in [0, 1], got: " + q);
        }
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
