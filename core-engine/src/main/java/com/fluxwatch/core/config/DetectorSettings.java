package com.fluxwatch.core.config;

import com.fluxwatch.core.detection.DecisionRule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Calibration and decision settings for one detector.
 *
 * <p>
 * Loaded from the {@code detector} section of the engine YAML. Call
 * {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Quantile of the calibration batch used as the initial threshold t. */
    private double lowQuantile = 0.98;

    /** Target long-run probability of a false extreme-value alarm. */
    private double riskLevel = 1e-3;

    /** Smallest calibration batch the calibrator accepts. */
    private int minCalibrationSize = 20;

    /** Number of cleaned observations a monitor collects before calibrating. */
    private int calibrationSize = 500;

    /** "threshold" or "anomaly_threshold". */
    private String decisionRule = DecisionRule.ANOMALY_THRESHOLD.getConfigName();

    /** Capacity of the recent-value window behind the anomaly threshold. */
    private int driftWindow = 20;

    /** Quantile of the drift window that can lift the anomaly threshold. */
    private double driftQuantile = 0.9;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every setting holds a legal value.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(lowQuantile > 0 && lowQuantile < 1)) {
            errors.add("'lowQuantile' must be in (0, 1), got: " + lowQuantile);
        }
        if (!(riskLevel > 0 && riskLevel < 1)) {
            errors.add("'riskLevel' must be in (0, 1), got: " + riskLevel);
        }
        if (minCalibrationSize < 1) {
            errors.add("'minCalibrationSize' must be >= 1, got: " + minCalibrationSize);
        }
        if (calibrationSize < minCalibrationSize) {
            errors.add("'calibrationSize' (" + calibrationSize
                    + ") must be >= 'minCalibrationSize' (" + minCalibrationSize + ")");
        }
        try {
            DecisionRule.fromConfig(decisionRule);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (driftWindow < 1) {
            errors.add("'driftWindow' must be >= 1, got: " + driftWindow);
        }
        if (!(driftQuantile > 0 && driftQuantile <= 1)) {
            errors.add("'driftQuantile' must be in (0, 1], got: " + driftQuantile);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid detector settings: " + String.join("; ", errors));
        }
    }

    /**
     * @return the configured decision rule as an enum
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public DecisionRule resolveDecisionRule() {
        return DecisionRule.fromConfig(decisionRule);
    }

    /**
     * @param size calibration batch size of the copy
     * @return a copy of these settings with a different calibration size
     */
    public DetectorSettings withCalibrationSize(int size) {
        DetectorSettings copy = new DetectorSettings();
        copy.lowQuantile = lowQuantile;
        copy.riskLevel = riskLevel;
        copy.minCalibrationSize = minCalibrationSize;
        copy.calibrationSize = size;
        copy.decisionRule = decisionRule;
        copy.driftWindow = driftWindow;
        copy.driftQuantile = driftQuantile;
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getLowQuantile() {
        return lowQuantile;
    }

    public void setLowQuantile(double lowQuantile) {
        this.lowQuantile = lowQuantile;
    }

    public double getRiskLevel() {
        return riskLevel;
    }

    public void setRiskLevel(double riskLevel) {
        this.riskLevel = riskLevel;
    }

    public int getMinCalibrationSize() {
        return minCalibrationSize;
    }

    public void setMinCalibrationSize(int minCalibrationSize) {
        this.minCalibrationSize = minCalibrationSize;
    }

    public int getCalibrationSize() {
        return calibrationSize;
    }

    public void setCalibrationSize(int calibrationSize) {
        this.calibrationSize = calibrationSize;
    }

    public String getDecisionRule() {
        return decisionRule;
    }

    /**
     * Set the decision rule, normalised to lowercase.
     *
     * @param decisionRule rule name
     */
    public void setDecisionRule(String decisionRule) {
        this.decisionRule = decisionRule != null ? decisionRule.toLowerCase(Locale.ROOT) : null;
    }

    public int getDriftWindow() {
        return driftWindow;
    }

    public void setDriftWindow(int driftWindow) {
        this.driftWindow = driftWindow;
    }

    public double getDriftQuantile() {
        return driftQuantile;
    }

    public void setDriftQuantile(double driftQuantile) {
        this.driftQuantile = driftQuantile;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorSettings that))
            return false;
        return Double.compare(lowQuantile, that.lowQuantile) == 0
                && Double.compare(riskLevel, that.riskLevel) == 0
                && minCalibrationSize == that.minCalibrationSize
                && calibrationSize == that.calibrationSize
                && Objects.equals(decisionRule, that.decisionRule)
                && driftWindow == that.driftWindow
                && Double.compare(driftQuantile, that.driftQuantile) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowQuantile, riskLevel, minCalibrationSize, calibrationSize,
                decisionRule, driftWindow, driftQuantile);
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "lowQuantile=" + lowQuantile +
                ", riskLevel=" + riskLevel +
                ", minCalibrationSize=" + minCalibrationSize +
                ", calibrationSize=" + calibrationSize +
                ", decisionRule='" + decisionRule + '\'' +
                ", driftWindow=" + driftWindow +
                ", driftQuantile=" + driftQuantile +
                '}';
    }
}
