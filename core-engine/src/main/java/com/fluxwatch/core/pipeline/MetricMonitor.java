package com.fluxwatch.core.pipeline;

import com.fluxwatch.core.calibration.PotCalibrator;
import com.fluxwatch.core.config.DetectorSettings;
import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.detection.DecisionRule;
import com.fluxwatch.core.detection.StreamingDetector;
import com.fluxwatch.core.model.CalibrationState;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.Observation;
import com.fluxwatch.core.preprocess.Preprocessor;
import com.fluxwatch.core.preprocess.TransformFactory;
import com.fluxwatch.core.preprocess.ValueTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complete detection pipeline for one metric stream.
 *
 * <p>
 * Raw observations are cleaned by a {@link Preprocessor} and mapped by the
 * configured {@link ValueTransform}. The first {@code calibrationSize}
 * observations are buffered and handed to the {@link PotCalibrator}; they
 * produce no detection results. Every later observation goes through the
 * {@link StreamingDetector}, and a flagged one is discarded from the
 * transform's history.
 * </p>
 *
 * <p>
 * The monitor is push-style and {@link Serializable} so one instance per key
 * can live in Flink keyed state. Imputed observations are excluded from the
 * calibration batch.
 * </p>
 *
 * <p>
 * A failed calibration is final for the run: the exception propagates once,
 * the buffered batch is released and every later call throws
 * {@link IllegalStateException}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; each stream owns one monitor.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricMonitor implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricMonitor.class);

    private final String metric;
    private final DetectorSettings detectorSettings;
    private final DecisionRule decisionRule;
    private final Preprocessor preprocessor;
    private final ValueTransform transform;
    private final List<Observation> calibrationBuffer = new ArrayList<>();
    private StreamingDetector detector;
    private RuntimeException calibrationFailure;

    /**
     * @param metric name of the monitored stream, used in logs
     * @param config engine configuration; validated here
     * @throws IllegalStateException if the configuration is invalid
     */
    public MetricMonitor(String metric, EngineConfig config) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(config, "EngineConfig must not be null");
        config.validate();
        this.detectorSettings = config.getDetector();
        this.decisionRule = detectorSettings.resolveDecisionRule();
        this.preprocessor = new Preprocessor(config.getPreprocessing(), false);
        this.transform = TransformFactory.create(config.getPreprocessing());
    }

    /**
     * Create a monitor that skips calibration and continues from a
     * checkpointed detector state.
     */
    public static MetricMonitor resume(String metric, EngineConfig config, CalibrationState state) {
        MetricMonitor monitor = new MetricMonitor(metric, config);
        monitor.detector = StreamingDetector.resume(state, monitor.decisionRule);
        return monitor;
    }

    /**
     * Push one raw observation through preprocessing and detection.
     *
     * @param raw the next raw observation
     * @return detection results, empty while calibrating
     */
    public List<DetectionResult> process(Observation raw) {
        ensureNotFailed();
        List<Observation> cleaned = preprocessor.accept(raw);
        if (cleaned.isEmpty()) {
            return Collections.emptyList();
        }
        List<DetectionResult> results = new ArrayList<>(cleaned.size());
        for (Observation obs : cleaned) {
            results.addAll(detect(obs));
        }
        return results;
    }

    /**
     * Push one already-cleaned observation, bypassing this monitor's
     * preprocessor. Used when cleaning runs on another thread.
     *
     * @param cleaned output of a cleaning-only {@link Preprocessor}
     *                ({@code applyTransform = false}) configured like this
     *                monitor's; the transform is applied here
     * @return a single result, or nothing while calibrating
     */
    public List<DetectionResult> detect(Observation cleaned) {
        Objects.requireNonNull(cleaned, "Observation must not be null");
        ensureNotFailed();
        Observation feature = cleaned.withValue(transform.apply(cleaned.getValue()));
        if (detector != null) {
            DetectionResult result = detector.evaluate(feature);
            if (result.isAnomaly()) {
                transform.discardLast();
            }
            return List.of(result);
        }
        calibrationBuffer.add(feature);
        if (calibrationBuffer.size() >= detectorSettings.getCalibrationSize()) {
            calibrate();
        }
        return Collections.emptyList();
    }

    /**
     * End of stream: flush the preprocessor and, if calibration never
     * completed, calibrate on whatever was buffered.
     *
     * @return results for observations released by the flush
     * @throws com.fluxwatch.core.exception.InsufficientDataException if the
     *         buffered batch is below {@code minCalibrationSize}
     */
    public List<DetectionResult> finish() {
        ensureNotFailed();
        List<DetectionResult> results = new ArrayList<>();
        for (Observation obs : preprocessor.flush()) {
            results.addAll(detect(obs));
        }
        completeCalibration();
        return results;
    }

    /**
     * Calibrate on the buffered observations if not yet calibrated.
     */
    public void completeCalibration() {
        ensureNotFailed();
        if (detector == null) {
            calibrate();
        }
    }

    private void calibrate() {
        List<Observation> batch = calibrationBuffer.stream()
                .filter(obs -> !obs.isImputed())
                .toList();
        LOG.info("Calibrating metric '{}' on {} observation(s) ({} imputed excluded)", metric, batch.size(),
                calibrationBuffer.size() - batch.size());
        calibrationBuffer.clear();
        try {
            CalibrationState state = new PotCalibrator(detectorSettings).calibrate(batch);
            detector = new StreamingDetector(state, decisionRule);
        } catch (RuntimeException e) {
            calibrationFailure = e;
            LOG.error("Calibration of metric '{}' failed, run aborted: {}", metric, e.getMessage());
            throw e;
        }
    }

    private void ensureNotFailed() {
        if (calibrationFailure != null) {
            throw new IllegalStateException("Metric '" + metric + "' aborted after a failed calibration: "
                    + calibrationFailure.getMessage(), calibrationFailure);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public boolean isCalibrated() {
        return detector != null;
    }

    /**
     * @return true once a calibration attempt has failed; the monitor then
     *         rejects every further call
     */
    public boolean isFailed() {
        return calibrationFailure != null;
    }

    /**
     * @return the current detector state
     * @throws IllegalStateException if the monitor has not calibrated yet
     */
    public CalibrationState getState() {
        if (detector == null) {
            throw new IllegalStateException("Metric '" + metric + "' is not calibrated yet");
        }
        return detector.getState();
    }

    public String getMetric() {
        return metric;
    }

    public DecisionRule getDecisionRule() {
        return decisionRule;
    }

    public int getBufferedCount() {
        return calibrationBuffer.size();
    }

    public long getDroppedCount() {
        return preprocessor.getDroppedCount();
    }
}
