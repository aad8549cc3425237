package com.fluxwatch.flink;

import com.fluxwatch.core.model.DetectionResult;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A detection result tagged with its metric, as published to Kafka.
 *
 * @since 1.0.0
 */
public class DetectionEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String metric;
    private long timestamp;
    private double value;
    private boolean anomaly;
    private double threshold;
    private double anomalyThreshold;
    private double tailShape;
    private double tailScale;
    private boolean imputed;
    private Instant detectedAt;

    public DetectionEvent() {
    }

    public DetectionEvent(String metric, DetectionResult result, Instant detectedAt) {
        Objects.requireNonNull(result, "DetectionResult must not be null");
        this.metric = metric;
        this.timestamp = result.getTimestamp();
        this.value = result.getValue();
        this.anomaly = result.isAnomaly();
        this.threshold = result.getThreshold();
        this.anomalyThreshold = result.getAnomalyThreshold();
        this.tailShape = result.getTailShape();
        this.tailScale = result.getTailScale();
        this.imputed = result.isImputed();
        this.detectedAt = detectedAt;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public void setAnomaly(boolean anomaly) {
        this.anomaly = anomaly;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public void setAnomalyThreshold(double anomalyThreshold) {
        this.anomalyThreshold = anomalyThreshold;
    }

    public double getTailShape() {
        return tailShape;
    }

    public void setTailShape(double tailShape) {
        this.tailShape = tailShape;
    }

    public double getTailScale() {
        return tailScale;
    }

    public void setTailScale(double tailScale) {
        this.tailScale = tailScale;
    }

    public boolean isImputed() {
        return imputed;
    }

    public void setImputed(boolean imputed) {
        this.imputed = imputed;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    @Override
    public String toString() {
        return "DetectionEvent{metric='" + metric + "', timestamp=" + timestamp + ", value=" + value
                + ", anomaly=" + anomaly + ", threshold=" + threshold + ", anomalyThreshold=" + anomalyThreshold
                + '}';
    }
}
