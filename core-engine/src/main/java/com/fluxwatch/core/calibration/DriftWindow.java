package com.fluxwatch.core.calibration;

import java.io.Serializable;
import java.util.Objects;

/**
 * Fixed-capacity ring buffer of the most recent values, used to lift the
 * anomaly threshold while the signal drifts upward.
 *
 * <p>
 * Every observation enters the window, anomalous ones included: the window
 * tracks the current operating level, while the tail model stays free of
 * anomalies. The anomaly threshold is
 * {@code max(initialThreshold, threshold, quantile(driftQuantile))}, so it
 * equals the extreme threshold in steady state and rises above it only
 * after the recent level has moved up.
 * </p>
 *
 * @since 1.0.0
 */
public class DriftWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] buffer;
    private final double quantile;
    private int start;
    private int size;

    /**
     * @param capacity maximum number of retained values (&gt;= 1)
     * @param quantile level of the window quantile, in (0, 1]
     */
    public DriftWindow(int capacity, double quantile) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Drift window capacity must be >= 1, got: " + capacity);
        }
        if (!(quantile > 0 && quantile <= 1)) {
            throw new IllegalArgumentException("Drift quantile must be in (0, 1], got: " + quantile);
        }
        this.buffer = new double[capacity];
        this.quantile = quantile;
    }

    /**
     * Create a window pre-filled with values, oldest first. Only the last
     * {@code capacity} values are kept.
     */
    public static DriftWindow of(int capacity, double quantile, double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        DriftWindow window = new DriftWindow(capacity, quantile);
        for (int i = Math.max(0, values.length - capacity); i < values.length; i++) {
            window.add(values[i]);
        }
        return window;
    }

    public void add(double value) {
        if (size < buffer.length) {
            buffer[(start + size) % buffer.length] = value;
            size++;
        } else {
            buffer[start] = value;
            start = (start + 1) % buffer.length;
        }
    }

    /**
     * @return the configured quantile of the retained values, or
     *         {@link Double#NEGATIVE_INFINITY} when the window is empty
     */
    public double currentQuantile() {
        if (size == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        return EmpiricalQuantile.of(toArray(), quantile);
    }

    /**
     * Combine the window with the tail-model thresholds.
     *
     * @param initialThreshold t, the floor of the result
     * @param threshold        the extreme threshold
     * @return the anomaly threshold
     */
    public double anomalyThreshold(double initialThreshold, double threshold) {
        return Math.max(initialThreshold, Math.max(threshold, currentQuantile()));
    }

    /**
     * @return retained values, oldest first
     */
    public double[] toArray() {
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = buffer[(start + i) % buffer.length];
        }
        return out;
    }

    public int getCapacity() {
        return buffer.length;
    }

    public double getQuantile() {
        return quantile;
    }

    public int size() {
        return size;
    }
}
