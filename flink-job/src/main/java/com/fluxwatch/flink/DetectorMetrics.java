package com.fluxwatch.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the detection operator.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code observations_processed_total}</li>
 * <li>{@code anomalies_detected_total}</li>
 * <li>{@code calibrations_completed_total}</li>
 * <li>{@code calibration_failures_total}: metrics whose run was aborted</li>
 * <li>{@code malformed_observations_total}: records rejected by the
 * preprocessor</li>
 * <li>{@code processing_latency_ms}</li>
 * </ul>
 */
public class DetectorMetrics {

    private final Counter observationsProcessed;
    private final Counter anomaliesDetected;
    private final Counter calibrationsCompleted;
    private final Counter calibrationFailures;
    private final Counter malformedObservations;
    private final Histogram processingLatency;

    public DetectorMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("fluxwatch");

        this.observationsProcessed = group.counter("observations_processed_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.calibrationsCompleted = group.counter("calibrations_completed_total");
        this.calibrationFailures = group.counter("calibration_failures_total");
        this.malformedObservations = group.counter("malformed_observations_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void incrementObservationsProcessed() {
        observationsProcessed.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void incrementCalibrationsCompleted() {
        calibrationsCompleted.inc();
    }

    public void incrementCalibrationFailures() {
        calibrationFailures.inc();
    }

    public void incrementMalformedObservations() {
        malformedObservations.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
