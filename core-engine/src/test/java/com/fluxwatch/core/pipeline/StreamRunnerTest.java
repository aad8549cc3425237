package com.fluxwatch.core.pipeline;

import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.exception.InsufficientExcessesException;
import com.fluxwatch.core.exception.MalformedInputException;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StreamRunner}.
 */
class StreamRunnerTest {

    private EngineConfig config;

    @BeforeEach
    void setUp() {
        config = new EngineConfig();
        config.getDetector().setCalibrationSize(200);
        config.getEvaluation().setBufferCapacity(4);
    }

    @Test
    @DisplayName("Should detect every post-calibration observation in order through a small buffer")
    void shouldRunStreamInOrder() throws InterruptedException {
        List<Observation> stream = baseline(1000);
        stream.set(600, new Observation(600, 80.0));

        StreamRunner.RunResult run = new StreamRunner(config).run("latency", stream);

        List<DetectionResult> results = run.getResults();
        assertThat(results).hasSize(800);
        assertThat(results.get(0).getTimestamp()).isEqualTo(200);
        assertThat(results).isSortedAccordingTo((a, b) -> Long.compare(a.getTimestamp(), b.getTimestamp()));
        assertThat(run.getThresholds()).hasSize(800);
        assertThat(results.get(400).isAnomaly()).isTrue();
        assertThat(run.getThresholds()[400]).isEqualTo(results.get(400).getAnomalyThreshold());
        assertThat(run.getAnomalyCount()).isGreaterThanOrEqualTo(1);
        assertThat(run.getFinalState().getObservationCount())
                .isEqualTo(1000 - run.getAnomalyCount());
    }

    @Test
    @DisplayName("Should trace the classic threshold under the threshold rule")
    void shouldTraceThresholdRule() throws InterruptedException {
        config.getDetector().setDecisionRule("threshold");

        StreamRunner.RunResult run = new StreamRunner(config).run("latency", baseline(300));

        assertThat(run.getThresholds()[50]).isEqualTo(run.getResults().get(50).getThreshold());
    }

    @Test
    @DisplayName("Should re-throw a failure raised while preprocessing")
    void shouldPropagateProducerFailure() {
        List<Observation> stream = baseline(500);
        stream.set(300, new Observation(300, Double.NaN));

        assertThatThrownBy(() -> new StreamRunner(config).run("latency", stream))
                .isInstanceOf(MalformedInputException.class)
                .satisfies(e -> assertThat(((MalformedInputException) e).getTimestamp()).isEqualTo(300));
    }

    @Test
    @DisplayName("Should propagate a calibration failure")
    void shouldPropagateCalibrationFailure() {
        List<Observation> constant = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            constant.add(new Observation(i, 3.0));
        }

        assertThatThrownBy(() -> new StreamRunner(config).run("flat", constant))
                .isInstanceOf(InsufficientExcessesException.class);
    }

    @Test
    @DisplayName("Should calibrate a stream shorter than the calibration size")
    void shouldCalibrateShortStream() throws InterruptedException {
        StreamRunner.RunResult run = new StreamRunner(config).run("latency", baseline(50));

        assertThat(run.getResults()).isEmpty();
        assertThat(run.getFinalState().getObservationCount()).isEqualTo(50);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<Observation> baseline(int size) {
        Random random = new Random(42);
        List<Observation> observations = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            observations.add(new Observation(i, 5 + random.nextGaussian() * 0.5));
        }
        return observations;
    }
}
