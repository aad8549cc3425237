package com.fluxwatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Outcome of classifying one observation.
 *
 * <p>
 * The streaming detector emits exactly one result per observation it
 * consumes, in input order. Threshold and tail-parameter fields reflect the
 * model <em>after</em> the step that produced this result, so a sequence of
 * results doubles as the decision-boundary trace for plotting.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Instances are immutable once built.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final double value;
    private final boolean anomaly;
    private final double threshold;
    private final double anomalyThreshold;
    private final double tailShape;
    private final double tailScale;
    private final boolean imputed;

    private DetectionResult(Builder b) {
        this.timestamp = b.timestamp;
        this.value = b.value;
        this.anomaly = b.anomaly;
        this.threshold = b.threshold;
        this.anomalyThreshold = b.anomalyThreshold;
        this.tailShape = b.tailShape;
        this.tailScale = b.tailScale;
        this.imputed = b.imputed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectionResult}.
     */
    public static class Builder {
        private long timestamp;
        private double value;
        private boolean anomaly;
        private double threshold;
        private double anomalyThreshold;
        private double tailShape;
        private double tailScale;
        private boolean imputed;

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder anomalyThreshold(double anomalyThreshold) {
            this.anomalyThreshold = anomalyThreshold;
            return this;
        }

        public Builder tailShape(double tailShape) {
            this.tailShape = tailShape;
            return this;
        }

        public Builder tailScale(double tailScale) {
            this.tailScale = tailScale;
            return this;
        }

        public Builder imputed(boolean imputed) {
            this.imputed = imputed;
            return this;
        }

        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    /**
     * @return the long-term extreme threshold derived from the tail fit
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * @return the short-term, drift-adjusted alarm line
     */
    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public double getTailShape() {
        return tailShape;
    }

    public double getTailScale() {
        return tailScale;
    }

    public boolean isImputed() {
        return imputed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && anomaly == that.anomaly
                && Double.compare(threshold, that.threshold) == 0
                && Double.compare(anomalyThreshold, that.anomalyThreshold) == 0
                && Double.compare(tailShape, that.tailShape) == 0
                && Double.compare(tailScale, that.tailScale) == 0
                && imputed == that.imputed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, anomaly, threshold, anomalyThreshold,
                tailShape, tailScale, imputed);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                ", anomaly=" + anomaly +
                ", threshold=" + threshold +
                ", anomalyThreshold=" + anomalyThreshold +
                ", tailShape=" + tailShape +
                ", tailScale=" + tailScale +
                (imputed ? ", imputed" : "") +
                '}';
    }
}
