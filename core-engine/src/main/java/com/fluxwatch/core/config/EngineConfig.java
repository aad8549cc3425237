package com.fluxwatch.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and falls back to its
 * default):
 * </p>
 *
 * <pre>
 * detector:
 *   lowQuantile: 0.98
 *   riskLevel: 0.001
 *   minCalibrationSize: 20
 *   calibrationSize: 500
 *   decisionRule: anomaly_threshold
 *   driftWindow: 20
 *   driftQuantile: 0.9
 * preprocessing:
 *   gapFillPolicy: forward_fill
 *   maxGap: 3
 *   transform: none
 * evaluation:
 *   detectionDelay: 7
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every section.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectorSettings detector = new DetectorSettings();
    private PreprocessingSettings preprocessing = new PreprocessingSettings();
    private EvaluationSettings evaluation = new EvaluationSettings();

    public DetectorSettings getDetector() {
        return detector;
    }

    public void setDetector(DetectorSettings detector) {
        this.detector = detector != null ? detector : new DetectorSettings();
    }

    public PreprocessingSettings getPreprocessing() {
        return preprocessing;
    }

    public void setPreprocessing(PreprocessingSettings preprocessing) {
        this.preprocessing = preprocessing != null ? preprocessing : new PreprocessingSettings();
    }

    public EvaluationSettings getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationSettings evaluation) {
        this.evaluation = evaluation != null ? evaluation : new EvaluationSettings();
    }

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects the errors of all sections and throws a single exception if
     * any of them is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        List<Runnable> checks = List.of(detector::validate, preprocessing::validate, evaluation::validate);

        for (Runnable check : checks) {
            try {
                check.run();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "detector=" + detector +
                ", preprocessing=" + preprocessing +
                ", evaluation=" + evaluation +
                '}';
    }
}
