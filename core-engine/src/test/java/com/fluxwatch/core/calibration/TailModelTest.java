package com.fluxwatch.core.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TailModel}, {@link ExcessStatistics} and
 * {@link EmpiricalQuantile}.
 */
class TailModelTest {

    @Test
    @DisplayName("Should fit shape and scale by the method of moments")
    void shouldFitByMoments() {
        ExcessStatistics excesses = statsOf(1, 2, 3);

        TailModel model = TailModel.fit(excesses);

        // m = 2, v = 2/3, m²/v = 6
        assertThat(model.getShape()).isCloseTo(-2.5, within(1e-9));
        assertThat(model.getScale()).isCloseTo(7.0, within(1e-9));
        assertThat(model.isExponential()).isFalse();
    }

    @Test
    @DisplayName("Should use the power form of the tail quantile")
    void shouldComputeGeneralThreshold() {
        TailModel model = new TailModel(-2.5, 7.0);

        // (σ/ξ)((r·n/Nt)^(-ξ) - 1) with r·n/Nt = 1/3
        double expected = (7.0 / -2.5) * (Math.pow(1.0 / 3, 2.5) - 1);
        assertThat(model.threshold(0, 0.01, 100, 3)).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Should use the logarithmic form when the shape is zero")
    void shouldComputeExponentialThreshold() {
        TailModel model = new TailModel(0.0, 2.0);

        assertThat(model.isExponential()).isTrue();
        assertThat(model.threshold(10, 0.01, 100, 10)).isCloseTo(10 - 2 * Math.log(0.1), within(1e-12));
    }

    @Test
    @DisplayName("Should treat identical excesses as zero variance")
    void shouldFallBackOnZeroVariance() {
        TailModel model = TailModel.fit(statsOf(4, 4, 4, 4));

        assertThat(model.getShape()).isEqualTo(0.0);
        assertThat(model.getScale()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should reject zero counts in the tail quantile")
    void shouldRejectZeroCounts() {
        TailModel model = new TailModel(0.1, 1.0);

        assertThatThrownBy(() -> model.threshold(0, 0.01, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should refuse to fit an empty excess set")
    void shouldRejectEmptyExcesses() {
        assertThatThrownBy(() -> TailModel.fit(new ExcessStatistics()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should interpolate quantiles between order statistics")
    void shouldInterpolateQuantiles() {
        double[] values = { 4, 1, 3, 2 };

        assertThat(EmpiricalQuantile.of(values, 0.0)).isEqualTo(1.0);
        assertThat(EmpiricalQuantile.of(values, 1.0)).isEqualTo(4.0);
        assertThat(EmpiricalQuantile.of(values, 0.5)).isEqualTo(2.5);
        assertThat(values).containsExactly(4, 1, 3, 2);
    }

    @Test
    @DisplayName("Should keep only the most recent values in the drift window")
    void shouldEvictOldestDriftValues() {
        DriftWindow window = DriftWindow.of(3, 1.0, new double[] { 1, 2, 3, 4 });
        window.add(5);

        assertThat(window.toArray()).containsExactly(3, 4, 5);
        assertThat(window.currentQuantile()).isEqualTo(5.0);
        assertThat(window.anomalyThreshold(1, 2)).isEqualTo(5.0);
        assertThat(window.anomalyThreshold(1, 9)).isEqualTo(9.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static ExcessStatistics statsOf(double... excesses) {
        ExcessStatistics stats = new ExcessStatistics();
        for (double e : excesses) {
            stats.add(e);
        }
        return stats;
    }
}
