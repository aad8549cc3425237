package com.fluxwatch.core.detection;

import com.fluxwatch.core.calibration.DriftWindow;
import com.fluxwatch.core.calibration.ExcessStatistics;
import com.fluxwatch.core.calibration.TailModel;
import com.fluxwatch.core.exception.MalformedInputException;
import com.fluxwatch.core.model.CalibrationState;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Objects;

/**
 * Streaming Peaks-Over-Threshold detector for a single metric stream.
 *
 * <p>
 * Consumes one observation at a time, in order, and returns its
 * {@link DetectionResult} before the next one is accepted. Each step:
 * </p>
 * <ol>
 * <li>classifies the value against the bound selected by the
 * {@link DecisionRule};</li>
 * <li>if the value is normal and above the initial threshold, folds the
 * excess into the running statistics and re-estimates the tail model and the
 * extreme threshold in O(1);</li>
 * <li>pushes the value into the drift window and recomputes the anomaly
 * threshold.</li>
 * </ol>
 *
 * <p>
 * Anomalous values never reach the excess statistics, so an incident cannot
 * widen the tail that is supposed to detect the next one. Imputed
 * observations are never flagged and never counted as excesses.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This is a <strong>stateful</strong> detector bound to one stream. Its
 * memory is fixed at construction: running sums plus a bounded drift window.
 * {@link #getState()} snapshots everything needed to resume.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe; one instance per stream, driven by one consumer.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamingDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(StreamingDetector.class);

    private final DecisionRule decisionRule;
    private final double initialThreshold;
    private final double lowQuantile;
    private final double riskLevel;

    private final ExcessStatistics excesses;
    private final DriftWindow window;
    private TailModel tail;
    private double threshold;
    private double anomalyThreshold;
    private long observationCount;

    /**
     * Start (or resume) a stream from a calibration snapshot.
     *
     * @param state        state produced by the calibrator or by
     *                     {@link #getState()}
     * @param decisionRule the bound that raises alarms for this run
     */
    public StreamingDetector(CalibrationState state, DecisionRule decisionRule) {
        Objects.requireNonNull(state, "CalibrationState must not be null");
        this.decisionRule = Objects.requireNonNull(decisionRule, "DecisionRule must not be null");
        this.initialThreshold = state.getInitialThreshold();
        this.lowQuantile = state.getLowQuantile();
        this.riskLevel = state.getRiskLevel();
        this.excesses = new ExcessStatistics(state.getExcessCount(), state.getExcessSum(),
                state.getExcessSumOfSquares());
        this.window = DriftWindow.of(state.getDriftWindow(), state.getDriftQuantile(), state.getRecentValues());
        this.tail = new TailModel(state.getTailShape(), state.getTailScale());
        this.threshold = state.getThreshold();
        this.anomalyThreshold = state.getAnomalyThreshold();
        this.observationCount = state.getObservationCount();
    }

    /**
     * Continue a stream from a snapshot taken with {@link #getState()}.
     *
     * @param state        checkpointed state
     * @param decisionRule the rule of the interrupted run
     * @return a detector that behaves exactly as the snapshotted one would
     */
    public static StreamingDetector resume(CalibrationState state, DecisionRule decisionRule) {
        StreamingDetector detector = new StreamingDetector(state, decisionRule);
        LOG.info("Resumed detector: observations={} excesses={} threshold={} anomalyThreshold={}",
                state.getObservationCount(), state.getExcessCount(), state.getThreshold(),
                state.getAnomalyThreshold());
        return detector;
    }

    /**
     * Classify one observation and update the model.
     *
     * @param observation the next observation of the stream
     * @return the decision and the thresholds after this step
     * @throws MalformedInputException if the value is not finite
     */
    public DetectionResult evaluate(Observation observation) {
        Objects.requireNonNull(observation, "Observation must not be null");
        double value = observation.getValue();
        if (!Double.isFinite(value)) {
            throw new MalformedInputException(observation.getTimestamp(), "non-finite value " + value);
        }

        boolean anomaly = !observation.isImputed() && value > currentBound();

        if (anomaly) {
            LOG.debug("Anomaly at {}: value={} threshold={} anomalyThreshold={} rule={}",
                    observation.getTimestamp(), value, threshold, anomalyThreshold, decisionRule);
        } else if (!observation.isImputed()) {
            observationCount++;
            if (value > initialThreshold) {
                excesses.add(value - initialThreshold);
                tail = TailModel.fit(excesses);
                threshold = tail.threshold(initialThreshold, riskLevel, observationCount, excesses.getCount());
                LOG.trace("Excess folded at {}: excesses={} ξ={} σ={} threshold={}",
                        observation.getTimestamp(), excesses.getCount(), tail.getShape(), tail.getScale(),
                        threshold);
            }
        }

        window.add(value);
        anomalyThreshold = window.anomalyThreshold(initialThreshold, threshold);

        return DetectionResult.builder()
                .timestamp(observation.getTimestamp())
                .value(value)
                .anomaly(anomaly)
                .threshold(threshold)
                .anomalyThreshold(anomalyThreshold)
                .tailShape(tail.getShape())
                .tailScale(tail.getScale())
                .imputed(observation.isImputed())
                .build();
    }

    private double currentBound() {
        return decisionRule == DecisionRule.THRESHOLD ? threshold : anomalyThreshold;
    }

    /**
     * Snapshot the detector. Feeding the snapshot to a new detector with the
     * same decision rule continues the stream exactly where this one is.
     *
     * @return immutable state snapshot
     */
    public CalibrationState getState() {
        return CalibrationState.builder()
                .initialThreshold(initialThreshold)
                .tailShape(tail.getShape())
                .tailScale(tail.getScale())
                .excessCount(excesses.getCount())
                .threshold(threshold)
                .anomalyThreshold(anomalyThreshold)
                .lowQuantile(lowQuantile)
                .riskLevel(riskLevel)
                .observationCount(observationCount)
                .excessSum(excesses.getSum())
                .excessSumOfSquares(excesses.getSumOfSquares())
                .driftWindow(window.getCapacity())
                .driftQuantile(window.getQuantile())
                .recentValues(window.toArray())
                .build();
    }

    public DecisionRule getDecisionRule() {
        return decisionRule;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getAnomalyThreshold() {
        return anomalyThreshold;
    }

    public long getExcessCount() {
        return excesses.getCount();
    }
}
