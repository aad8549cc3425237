package com.fluxwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Snapshot of everything a streaming detector knows about one metric stream.
 *
 * <p>
 * Produced once by the calibrator and afterwards by
 * {@code StreamingDetector#getState()}; it is the only artifact required to
 * resume a stream between observations. Its size does not depend on the
 * number of observations consumed: the excess set is summarised by running
 * sums and the drift window has a fixed capacity.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code anomalyThreshold >= initialThreshold}</li>
 * <li>{@code excessCount >= 0}, {@code observationCount >= excessCount}</li>
 * <li>every threshold is a finite number</li>
 * <li>{@code driftQuantile} in (0, 1]; {@code lowQuantile} and
 * {@code riskLevel} in (0, 1)</li>
 * </ul>
 * <p>
 * {@link Builder#build()} rejects snapshots that break them, which also
 * guards against resuming from a corrupted checkpoint.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = CalibrationState.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CalibrationState implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Empirical {@code lowQuantile} of the calibration batch (t). */
    private final double initialThreshold;

    /** GPD shape ξ. */
    private final double tailShape;

    /** GPD scale σ. */
    private final double tailScale;

    /** Number of excesses folded into the tail model (Nt). */
    private final long excessCount;

    /** Long-term extreme threshold from the tail quantile formula. */
    private final double threshold;

    /** Short-term, drift-adjusted alarm line. */
    private final double anomalyThreshold;

    private final double lowQuantile;
    private final double riskLevel;

    /** Non-anomalous observations seen so far, calibration batch included (n). */
    private final long observationCount;

    private final double excessSum;
    private final double excessSumOfSquares;

    private final int driftWindow;
    private final double driftQuantile;

    /** Most recent values, oldest first, at most {@code driftWindow} of them. */
    private final double[] recentValues;

    private CalibrationState(Builder b) {
        this.initialThreshold = b.initialThreshold;
        this.tailShape = b.tailShape;
        this.tailScale = b.tailScale;
        this.excessCount = b.excessCount;
        this.threshold = b.threshold;
        this.anomalyThreshold = b.anomalyThreshold;
        this.lowQuantile = b.lowQuantile;
        this.riskLevel = b.riskLevel;
        this.observationCount = b.observationCount;
        this.excessSum = b.excessSum;
        this.excessSumOfSquares = b.excessSumOfSquares;
        this.driftWindow = b.driftWindow;
        this.driftQuantile = b.driftQuantile;
        this.recentValues = b.recentValues.clone();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; also used by Jackson when a checkpoint is read back.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private double initialThreshold;
        private double tailShape;
        private double tailScale;
        private long excessCount;
        private double threshold;
        private double anomalyThreshold;
        private double lowQuantile;
        private double riskLevel;
        private long observationCount;
        private double excessSum;
        private double excessSumOfSquares;
        private int driftWindow;
        private double driftQuantile;
        private double[] recentValues = new double[0];

        public Builder initialThreshold(double v) {
            this.initialThreshold = v;
            return this;
        }

        public Builder tailShape(double v) {
            this.tailShape = v;
            return this;
        }

        public Builder tailScale(double v) {
            this.tailScale = v;
            return this;
        }

        public Builder excessCount(long v) {
            this.excessCount = v;
            return this;
        }

        public Builder threshold(double v) {
            this.threshold = v;
            return this;
        }

        public Builder anomalyThreshold(double v) {
            this.anomalyThreshold = v;
            return this;
        }

        public Builder lowQuantile(double v) {
            this.lowQuantile = v;
            return this;
        }

        public Builder riskLevel(double v) {
            this.riskLevel = v;
            return this;
        }

        public Builder observationCount(long v) {
            this.observationCount = v;
            return this;
        }

        public Builder excessSum(double v) {
            this.excessSum = v;
            return this;
        }

        public Builder excessSumOfSquares(double v) {
            this.excessSumOfSquares = v;
            return this;
        }

        public Builder driftWindow(int v) {
            this.driftWindow = v;
            return this;
        }

        public Builder driftQuantile(double v) {
            this.driftQuantile = v;
            return this;
        }

        public Builder recentValues(double[] v) {
            this.recentValues = Objects.requireNonNull(v, "recentValues must not be null");
            return this;
        }

        /**
         * Build the snapshot.
         *
         * @return a new {@link CalibrationState}
         * @throws IllegalStateException if an invariant is violated
         */
        public CalibrationState build() {
            if (excessCount < 0 || observationCount < excessCount) {
                throw new IllegalStateException("Invalid counts: excessCount=" + excessCount
                        + ", observationCount=" + observationCount);
            }
            if (!Double.isFinite(initialThreshold) || !Double.isFinite(threshold)
                    || !Double.isFinite(anomalyThreshold)) {
                throw new IllegalStateException("Thresholds must be finite: initial=" + initialThreshold
                        + ", threshold=" + threshold + ", anomalyThreshold=" + anomalyThreshold);
            }
            if (anomalyThreshold < initialThreshold) {
                throw new IllegalStateException("anomalyThreshold (" + anomalyThreshold
                        + ") must be >= initialThreshold (" + initialThreshold + ")");
            }
            if (driftWindow < 1 || recentValues.length > driftWindow) {
                throw new IllegalStateException("Drift window holds " + recentValues.length
                        + " value(s) but capacity is " + driftWindow);
            }
            if (!(driftQuantile > 0 && driftQuantile <= 1)) {
                throw new IllegalStateException("driftQuantile must be in (0, 1], got: " + driftQuantile);
            }
            if (!(lowQuantile > 0 && lowQuantile < 1) || !(riskLevel > 0 && riskLevel < 1)) {
                throw new IllegalStateException("lowQuantile and riskLevel must be in (0, 1), got: "
                        + lowQuantile + ", " + riskLevel);
            }
            return new CalibrationState(this);
        }
    }

    public double getInitialThreshold() {
        return initialThreshold;
    }

    public double getTailShape() {
        return tailShape;
    }

    public double getTailScale() {
        return tailScale;
    }

    public long getExcessCount() {
        return excessCount;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public double getLowQuantile() {
        return lowQuantile;
    }

    public double getRiskLevel() {
        return riskLevel;
    }

    public long getObservationCount() {
        return observationCount;
    }

    public double getExcessSum() {
        return excessSum;
    }

    public double getExcessSumOfSquares() {
        return excessSumOfSquares;
    }

    public int getDriftWindow() {
        return driftWindow;
    }

    public double getDriftQuantile() {
        return driftQuantile;
    }

    /**
     * @return a copy of the drift window contents, oldest first
     */
    public double[] getRecentValues() {
        return recentValues.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CalibrationState that))
            return false;
        return Double.compare(initialThreshold, that.initialThreshold) == 0
                && Double.compare(tailShape, that.tailShape) == 0
                && Double.compare(tailScale, that.tailScale) == 0
                && excessCount == that.excessCount
                && Double.compare(threshold, that.threshold) == 0
                && Double.compare(anomalyThreshold, that.anomalyThreshold) == 0
                && Double.compare(lowQuantile, that.lowQuantile) == 0
                && Double.compare(riskLevel, that.riskLevel) == 0
                && observationCount == that.observationCount
                && Double.compare(excessSum, that.excessSum) == 0
                && Double.compare(excessSumOfSquares, that.excessSumOfSquares) == 0
                && driftWindow == that.driftWindow
                && Double.compare(driftQuantile, that.driftQuantile) == 0
                && Arrays.equals(recentValues, that.recentValues);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(initialThreshold, tailShape, tailScale, excessCount, threshold,
                anomalyThreshold, lowQuantile, riskLevel, observationCount, excessSum,
                excessSumOfSquares, driftWindow, driftQuantile);
        return 31 * result + Arrays.hashCode(recentValues);
    }

    @Override
    public String toString() {
        return "CalibrationState{" +
                "initialThreshold=" + initialThreshold +
                ", tailShape=" + tailShape +
                ", tailScale=" + tailScale +
                ", excessCount=" + excessCount +
                ", threshold=" + threshold +
                ", anomalyThreshold=" + anomalyThreshold +
                ", lowQuantile=" + lowQuantile +
                ", riskLevel=" + riskLevel +
                ", observationCount=" + observationCount +
                ", driftWindow=" + recentValues.length + "/" + driftWindow +
                '}';
    }
}
