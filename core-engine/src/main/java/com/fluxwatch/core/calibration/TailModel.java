package com.fluxwatch.core.calibration;

import java.io.Serializable;
import java.util.Objects;

/**
 * Generalized Pareto model of the threshold excesses.
 *
 * <p>
 * Parameters are estimated by the method of moments from the excess mean
 * {@code m} and variance {@code v}:
 * </p>
 *
 * <pre>
 *   ξ = (1 - m² / v) / 2
 *   σ = m (1 + m² / v) / 2
 * </pre>
 *
 * <p>
 * The closed form needs no iterative solver, so a fit can neither fail to
 * converge nor differ between runs on the same input. When the excesses have
 * (numerically) zero variance, which includes the single-excess case, the
 * model degenerates to an exponential tail: {@code ξ = 0}, {@code σ = m}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TailModel implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Shapes closer to zero than this use the exponential-tail formula. */
    static final double SHAPE_EPSILON = 1e-9;

    private final double shape;
    private final double scale;

    public TailModel(double shape, double scale) {
        this.shape = shape;
        this.scale = scale;
    }

    /**
     * Fit the model to the excess statistics.
     *
     * @param excesses non-empty excess statistics
     * @return fitted model; never contains NaN or infinite parameters
     * @throws IllegalStateException if {@code excesses} is empty
     */
    public static TailModel fit(ExcessStatistics excesses) {
        Objects.requireNonNull(excesses, "excesses must not be null");
        double mean = excesses.getMean();
        double variance = excesses.getVariance();
        if (variance == 0) {
            return new TailModel(0.0, mean);
        }

        double ratio = mean * mean / variance;
        double shape = 0.5 * (1 - ratio);
        double scale = 0.5 * mean * (1 + ratio);
        if (!Double.isFinite(shape) || !Double.isFinite(scale)) {
            return new TailModel(0.0, mean);
        }
        return new TailModel(shape, scale);
    }

    /**
     * Extreme threshold for the given risk level:
     *
     * <pre>
     *   t + (σ/ξ) ((r n / Nt)^(-ξ) - 1)   for ξ ≠ 0
     *   t - σ ln(r n / Nt)                for ξ = 0
     * </pre>
     *
     * <p>
     * An overflowing power falls back to the exponential form, so the result
     * is always finite.
     * </p>
     *
     * @param initialThreshold t
     * @param riskLevel        r, in (0, 1)
     * @param observations     n, observations behind the model (&gt;= 1)
     * @param excessCount      Nt, excesses behind the model (&gt;= 1)
     * @return the threshold
     */
    public double threshold(double initialThreshold, double riskLevel, long observations, long excessCount) {
        if (observations < 1 || excessCount < 1) {
            throw new IllegalArgumentException("observations and excessCount must be >= 1, got: "
                    + observations + ", " + excessCount);
        }
        double ratio = riskLevel * observations / excessCount;
        if (Math.abs(shape) >= SHAPE_EPSILON) {
            double threshold = initialThreshold + (scale / shape) * (Math.pow(ratio, -shape) - 1);
            if (Double.isFinite(threshold)) {
                return threshold;
            }
        }
        return initialThreshold - scale * Math.log(ratio);
    }

    public double getShape() {
        return shape;
    }

    public double getScale() {
        return scale;
    }

    public boolean isExponential() {
        return Math.abs(shape) < SHAPE_EPSILON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TailModel that))
            return false;
        return Double.compare(shape, that.shape) == 0 && Double.compare(scale, that.scale) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, scale);
    }

    @Override
    public String toString() {
        return "TailModel{ξ=" + shape + ", σ=" + scale + '}';
    }
}
