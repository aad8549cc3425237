package com.fluxwatch.core.calibration;

import com.fluxwatch.core.config.DetectorSettings;
import com.fluxwatch.core.exception.InsufficientDataException;
import com.fluxwatch.core.exception.InsufficientExcessesException;
import com.fluxwatch.core.model.CalibrationState;
import com.fluxwatch.core.model.Observation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PotCalibrator}.
 */
class PotCalibratorTest {

    @Test
    @DisplayName("Should fall back to an exponential tail for a single excess")
    void shouldHandleSingleExcess() {
        DetectorSettings settings = new DetectorSettings();
        settings.setLowQuantile(0.8);
        settings.setMinCalibrationSize(1);

        CalibrationState state = new PotCalibrator(settings).calibrate(new double[] { 1, 1, 1, 1, 1, 10 });

        assertThat(state.getInitialThreshold()).isEqualTo(1.0);
        assertThat(state.getExcessCount()).isEqualTo(1);
        assertThat(state.getTailShape()).isEqualTo(0.0);
        assertThat(state.getTailScale()).isEqualTo(9.0);
        // t - σ·ln(r·n/Nt) with r = 1e-3, n = 6, Nt = 1
        assertThat(state.getThreshold()).isCloseTo(1 - 9 * Math.log(0.006), within(1e-9));
        assertThat(state.getAnomalyThreshold()).isEqualTo(state.getThreshold());
    }

    @Test
    @DisplayName("Should produce finite thresholds on a noisy baseline")
    void shouldProduceFiniteThresholds() {
        CalibrationState state = new PotCalibrator(new DetectorSettings()).calibrate(baseline(500, 42));

        assertThat(state.getInitialThreshold()).isFinite();
        assertThat(state.getThreshold()).isFinite().isGreaterThan(state.getInitialThreshold());
        assertThat(state.getAnomalyThreshold()).isFinite().isGreaterThanOrEqualTo(state.getInitialThreshold());
        assertThat(state.getTailScale()).isPositive();
        assertThat(state.getObservationCount()).isEqualTo(500);
        assertThat(state.getExcessCount()).isEqualTo(10);
        assertThat(state.getRecentValues()).hasSize(20);
    }

    @Test
    @DisplayName("Should be a pure function of batch and settings")
    void shouldBeIdempotent() {
        PotCalibrator calibrator = new PotCalibrator(new DetectorSettings());
        double[] batch = baseline(300, 7);

        assertThat(calibrator.calibrate(batch)).isEqualTo(calibrator.calibrate(batch.clone()));
    }

    @Test
    @DisplayName("Should accept observations as well as raw values")
    void shouldCalibrateObservations() {
        double[] batch = baseline(100, 3);
        List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < batch.length; i++) {
            observations.add(new Observation(i, batch[i]));
        }
        PotCalibrator calibrator = new PotCalibrator(new DetectorSettings());

        assertThat(calibrator.calibrate(observations)).isEqualTo(calibrator.calibrate(batch));
    }

    @Test
    @DisplayName("Should reject a batch below the minimum size")
    void shouldRejectSmallBatch() {
        PotCalibrator calibrator = new PotCalibrator(new DetectorSettings());

        assertThatThrownBy(() -> calibrator.calibrate(baseline(5, 1)))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> {
                    InsufficientDataException ex = (InsufficientDataException) e;
                    assertThat(ex.getBatchSize()).isEqualTo(5);
                    assertThat(ex.getRequiredSize()).isEqualTo(20);
                });
    }

    @Test
    @DisplayName("Should reject an empty batch even with a minimum of one")
    void shouldRejectEmptyBatch() {
        DetectorSettings settings = new DetectorSettings();
        settings.setMinCalibrationSize(1);

        assertThatThrownBy(() -> new PotCalibrator(settings).calibrate(new double[0]))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Should report the quantile when no value exceeds it")
    void shouldRejectConstantBatch() {
        double[] constant = new double[30];
        java.util.Arrays.fill(constant, 3.0);

        assertThatThrownBy(() -> new PotCalibrator(new DetectorSettings()).calibrate(constant))
                .isInstanceOf(InsufficientExcessesException.class)
                .satisfies(e -> {
                    InsufficientExcessesException ex = (InsufficientExcessesException) e;
                    assertThat(ex.getLowQuantile()).isEqualTo(0.98);
                    assertThat(ex.getInitialThreshold()).isEqualTo(3.0);
                });
    }

    @Test
    @DisplayName("Should reject non-finite values in the batch")
    void shouldRejectNonFiniteValues() {
        double[] batch = baseline(30, 5);
        batch[12] = Double.NaN;

        assertThatThrownBy(() -> new PotCalibrator(new DetectorSettings()).calibrate(batch))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 12");
    }

    @Test
    @DisplayName("Should refuse invalid settings at construction")
    void shouldValidateSettings() {
        DetectorSettings settings = new DetectorSettings();
        settings.setRiskLevel(2.0);

        assertThatThrownBy(() -> new PotCalibrator(settings))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("riskLevel");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static double[] baseline(int size, long seed) {
        Random random = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 5 + random.nextGaussian() * 0.5;
        }
        return values;
    }
}
