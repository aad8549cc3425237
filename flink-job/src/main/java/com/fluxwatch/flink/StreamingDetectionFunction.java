package com.fluxwatch.flink;

import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.exception.AnomalyEngineException;
import com.fluxwatch.core.exception.MalformedInputException;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.pipeline.MetricMonitor;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs one {@link MetricMonitor} per metric key.
 *
 * <p>
 * The monitor lives in Flink keyed {@code ValueState}, so every metric is
 * calibrated and scored in isolation and its detector state is part of
 * every checkpoint. A monitor is created lazily on a key's first event.
 * </p>
 *
 * <h3>Failure Handling</h3>
 * <ul>
 * <li>A record rejected by the preprocessor is counted and dropped; the
 * metric's run continues.</li>
 * <li>A calibration failure aborts that metric only: it is logged at ERROR,
 * counted, its monitor is discarded and later events for the key are
 * ignored. Other keys are unaffected.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class StreamingDetectionFunction
        extends KeyedProcessFunction<String, MetricEvent, DetectionEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(StreamingDetectionFunction.class);

    private final EngineConfig engineConfig;
    private final boolean emitAllResults;

    private transient ValueState<MetricMonitor> monitorState;
    private transient ValueState<Boolean> abortedState;
    private transient DetectorMetrics metrics;

    /**
     * @param engineConfig   engine configuration; validated here
     * @param emitAllResults publish every result instead of anomalies only
     */
    public StreamingDetectionFunction(EngineConfig engineConfig, boolean emitAllResults) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "EngineConfig must not be null");
        engineConfig.validate();
        this.emitAllResults = emitAllResults;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        monitorState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("metric-monitor", TypeInformation.of(MetricMonitor.class)));
        abortedState = getRuntimeContext().getState(
                new ValueStateDescriptor<>("metric-aborted", Types.BOOLEAN));
        metrics = new DetectorMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("StreamingDetectionFunction opened (decisionRule={}, emitAllResults={})",
                engineConfig.getDetector().getDecisionRule(), emitAllResults);
    }

    @Override
    public void close() {
        LOG.info("StreamingDetectionFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(MetricEvent event,
            KeyedProcessFunction<String, MetricEvent, DetectionEvent>.Context ctx,
            Collector<DetectionEvent> out) throws Exception {
        String metric = ctx.getCurrentKey();
        if (Boolean.TRUE.equals(abortedState.value())) {
            LOG.trace("Ignoring event for aborted metric '{}'", metric);
            return;
        }
        long startNanos = System.nanoTime();

        MetricMonitor monitor = monitorState.value();
        if (monitor == null) {
            monitor = new MetricMonitor(metric, engineConfig);
            LOG.info("Started monitoring metric '{}'", metric);
        }
        boolean wasCalibrated = monitor.isCalibrated();

        List<DetectionResult> results;
        try {
            results = monitor.process(event.toObservation());
        } catch (MalformedInputException e) {
            metrics.incrementMalformedObservations();
            LOG.warn("Metric '{}': {}", metric, e.getMessage());
            monitorState.update(monitor);
            return;
        } catch (AnomalyEngineException e) {
            metrics.incrementCalibrationFailures();
            LOG.error("Calibration failed for metric '{}', aborting its run: {}", metric, e.getMessage(), e);
            monitorState.clear();
            abortedState.update(true);
            return;
        }

        if (!wasCalibrated && monitor.isCalibrated()) {
            metrics.incrementCalibrationsCompleted();
            LOG.info("Metric '{}' calibrated: {}", metric, monitor.getState());
        }

        Instant now = Instant.now();
        for (DetectionResult result : results) {
            metrics.incrementObservationsProcessed();
            if (result.isAnomaly()) {
                metrics.incrementAnomaliesDetected();
                LOG.info("Anomaly: metric={} timestamp={} value={} anomalyThreshold={}",
                        metric, result.getTimestamp(), result.getValue(), result.getAnomalyThreshold());
            }
            if (emitAllResults || result.isAnomaly()) {
                out.collect(new DetectionEvent(metric, result, now));
            }
        }

        monitorState.update(monitor);
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }
}
