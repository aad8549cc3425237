package com.fluxwatch.core.pipeline;

import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.detection.DecisionRule;
import com.fluxwatch.core.exception.AnomalyEngineException;
import com.fluxwatch.core.model.CalibrationState;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.Observation;
import com.fluxwatch.core.preprocess.Preprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one finite stream end to end with a bounded hand-off between
 * preprocessing and detection.
 *
 * <p>
 * A producer thread pulls raw observations from the source, cleans them and
 * puts them on an {@link ArrayBlockingQueue} of {@code bufferCapacity}
 * slots; the calling thread is the single consumer that applies the value
 * transform, calibrates and detects, so detector decisions can feed back
 * into the transform. The producer blocks when the buffer is full, the
 * consumer when it is empty. A failure on the producer side is re-thrown to the caller once
 * the consumer reaches it; a failure on the consumer side stops the
 * producer.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamRunner {

    private static final Logger LOG = LoggerFactory.getLogger(StreamRunner.class);

    /** End-of-stream marker, compared by identity. */
    private static final Observation END = new Observation(Long.MIN_VALUE, Double.NaN);

    private final EngineConfig config;

    /**
     * @param config engine configuration; validated here
     */
    public StreamRunner(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        config.validate();
    }

    public RunResult run(String metric, List<Observation> observations) throws InterruptedException {
        Objects.requireNonNull(observations, "observations must not be null");
        return run(metric, observations.iterator());
    }

    /**
     * Run a stream to completion.
     *
     * @param metric name of the stream, used in logs and thread names
     * @param source raw observations in arrival order
     * @return detection results in order plus the active-threshold trace
     * @throws InterruptedException if the calling thread is interrupted
     * @throws AnomalyEngineException on calibration or input failures
     */
    public RunResult run(String metric, Iterator<Observation> source) throws InterruptedException {
        Objects.requireNonNull(source, "source must not be null");
        BlockingQueue<Observation> buffer = new ArrayBlockingQueue<>(config.getEvaluation().getBufferCapacity());
        AtomicReference<RuntimeException> producerFailure = new AtomicReference<>();
        Preprocessor preprocessor = new Preprocessor(config.getPreprocessing(), false);
        MetricMonitor monitor = new MetricMonitor(metric, config);

        Thread producer = new Thread(() -> produce(preprocessor.normalize(source), buffer, producerFailure),
                "fluxwatch-producer-" + metric);
        producer.setDaemon(true);
        producer.start();
        LOG.debug("Started producer for metric '{}' (buffer capacity {})", metric, buffer.remainingCapacity());

        List<DetectionResult> results = new ArrayList<>();
        try {
            Observation next;
            while ((next = buffer.take()) != END) {
                results.addAll(monitor.detect(next));
            }
            RuntimeException failure = producerFailure.get();
            if (failure != null) {
                throw failure;
            }
            monitor.completeCalibration();
        } finally {
            producer.interrupt();
            producer.join();
        }

        LOG.info("Metric '{}': {} result(s), {} anomaly(ies), {} dropped record(s)", metric, results.size(),
                results.stream().filter(DetectionResult::isAnomaly).count(), preprocessor.getDroppedCount());
        return new RunResult(results, monitor.getDecisionRule(), monitor.getState(), preprocessor.getDroppedCount());
    }

    private static void produce(Iterator<Observation> cleaned, BlockingQueue<Observation> buffer,
            AtomicReference<RuntimeException> failure) {
        try {
            while (cleaned.hasNext()) {
                buffer.put(cleaned.next());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            failure.set(e);
        }
        try {
            buffer.put(END);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------
    // Result
    // ---------------------------------------------------------------

    /**
     * Outcome of one run.
     */
    public static final class RunResult {

        private final List<DetectionResult> results;
        private final double[] thresholds;
        private final CalibrationState finalState;
        private final long droppedCount;

        RunResult(List<DetectionResult> results, DecisionRule rule, CalibrationState finalState,
                long droppedCount) {
            this.results = Collections.unmodifiableList(results);
            this.thresholds = results.stream()
                    .mapToDouble(r -> rule == DecisionRule.THRESHOLD ? r.getThreshold() : r.getAnomalyThreshold())
                    .toArray();
            this.finalState = finalState;
            this.droppedCount = droppedCount;
        }

        public List<DetectionResult> getResults() {
            return results;
        }

        /**
         * @return the alarm line in force after each result, parallel to
         *         {@link #getResults()}
         */
        public double[] getThresholds() {
            return thresholds.clone();
        }

        public CalibrationState getFinalState() {
            return finalState;
        }

        public long getDroppedCount() {
            return droppedCount;
        }

        public long getAnomalyCount() {
            return results.stream().filter(DetectionResult::isAnomaly).count();
        }
    }
}
