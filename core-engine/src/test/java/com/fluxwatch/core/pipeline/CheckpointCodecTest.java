package com.fluxwatch.core.pipeline;

import com.fluxwatch.core.calibration.PotCalibrator;
import com.fluxwatch.core.config.DetectorSettings;
import com.fluxwatch.core.detection.DecisionRule;
import com.fluxwatch.core.detection.StreamingDetector;
import com.fluxwatch.core.exception.AnomalyEngineException;
import com.fluxwatch.core.model.CalibrationState;
import com.fluxwatch.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckpointCodec}.
 */
class CheckpointCodecTest {

    private final CheckpointCodec codec = new CheckpointCodec();
    private Random random;
    private StreamingDetector detector;

    @BeforeEach
    void setUp() {
        random = new Random(5);
        double[] batch = new double[300];
        for (int i = 0; i < batch.length; i++) {
            batch[i] = noisy();
        }
        CalibrationState state = new PotCalibrator(new DetectorSettings()).calibrate(batch);
        detector = new StreamingDetector(state, DecisionRule.ANOMALY_THRESHOLD);
        for (int i = 0; i < 50; i++) {
            detector.evaluate(new Observation(i, noisy()));
        }
    }

    @Test
    @DisplayName("Should restore an equal state from JSON")
    void shouldRoundTripState() {
        CalibrationState state = detector.getState();

        String json = codec.toJson(state);

        assertThat(json).contains("\"initialThreshold\"").contains("\"recentValues\"");
        assertThat(codec.fromJson(json)).isEqualTo(state);
        assertThat(codec.fromBytes(codec.toBytes(state))).isEqualTo(state);
    }

    @Test
    @DisplayName("Should resume a stream from a decoded checkpoint")
    void shouldResumeFromCheckpoint() {
        StreamingDetector resumed = StreamingDetector.resume(
                codec.fromJson(codec.toJson(detector.getState())), DecisionRule.ANOMALY_THRESHOLD);

        for (int i = 50; i < 150; i++) {
            Observation obs = new Observation(i, i == 120 ? 40.0 : noisy());
            assertThat(resumed.evaluate(obs)).isEqualTo(detector.evaluate(obs));
        }
    }

    @Test
    @DisplayName("Should reject a checkpoint that breaks the state invariants")
    void shouldRejectInvalidCheckpoint() {
        String json = codec.toJson(detector.getState())
                .replaceFirst("\"anomalyThreshold\":[^,]+", "\"anomalyThreshold\":-1000.0");

        assertThatThrownBy(() -> codec.fromJson(json)).isInstanceOf(AnomalyEngineException.class);
    }

    @Test
    @DisplayName("Should reject a checkpoint whose drift quantile is out of range")
    void shouldRejectOutOfRangeDriftQuantile() {
        String json = codec.toJson(detector.getState())
                .replaceFirst("\"driftQuantile\":[^,}]+", "\"driftQuantile\":0.0");

        assertThatThrownBy(() -> codec.fromJson(json))
                .isInstanceOf(AnomalyEngineException.class)
                .hasMessageContaining("driftQuantile");
        assertThatThrownBy(() -> codec.fromBytes(json.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(AnomalyEngineException.class);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> codec.fromJson("{not json"))
                .isInstanceOf(AnomalyEngineException.class)
                .hasMessageContaining("decode");
    }

    private double noisy() {
        return 5 + random.nextGaussian() * 0.5;
    }
}
