package com.fluxwatch.core.evaluation;

import com.fluxwatch.core.calibration.PotCalibrator;
import com.fluxwatch.core.config.DetectorSettings;
import com.fluxwatch.core.config.EvaluationSettings;
import com.fluxwatch.core.detection.DecisionRule;
import com.fluxwatch.core.detection.StreamingDetector;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.EvaluationScore;
import com.fluxwatch.core.model.LabeledInterval;
import com.fluxwatch.core.model.Observation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Evaluator}.
 */
class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator();

    @Test
    @DisplayName("Should score nothing against nothing as all zeros")
    void shouldScoreEmptyInput() {
        EvaluationScore score = evaluator.score(Collections.emptyList(), Collections.emptyList());

        assertThat(score).isEqualTo(EvaluationScore.empty());
        assertThat(score.getPrecision()).isZero();
        assertThat(score.getRecall()).isZero();
        assertThat(score.getF1()).isZero();
    }

    @Test
    @DisplayName("Should credit a single-point interval flagged on its only point")
    void shouldScoreHandFlaggedSpike() {
        List<DetectionResult> results = List.of(
                result(1, false), result(2, false), result(3, false), result(4, false), result(5, true));

        EvaluationScore score = evaluator.score(results, List.of(new LabeledInterval(5, 5)));

        assertThat(score.getTruePositive()).isEqualTo(1);
        assertThat(score.getFalsePositive()).isZero();
        assertThat(score.getFalseNegative()).isZero();
        assertThat(score.getF1()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score a detected spike perfectly end to end")
    void shouldScoreDetectorOutputPerfectly() {
        DetectorSettings settings = new DetectorSettings();
        settings.setLowQuantile(0.8);
        settings.setMinCalibrationSize(1);
        StreamingDetector detector = new StreamingDetector(
                new PotCalibrator(settings).calibrate(new double[] { 1, 1, 1, 1, 1, 10 }),
                DecisionRule.ANOMALY_THRESHOLD);

        double[] stream = { 2, 2, 2, 2, 100 };
        List<DetectionResult> results = new ArrayList<>();
        for (int i = 0; i < stream.length; i++) {
            results.add(detector.evaluate(new Observation(i + 1, stream[i])));
        }

        assertThat(results).extracting(DetectionResult::isAnomaly)
                .containsExactly(false, false, false, false, true);
        EvaluationScore score = evaluator.score(results, List.of(new LabeledInterval(5, 5)));
        assertThat(score).isEqualTo(new EvaluationScore(1, 0, 0));
        assertThat(score.getF1()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should credit every interval that contains an alarm")
    void shouldCreditOverlappingIntervals() {
        List<DetectionResult> results = List.of(result(4, false), result(5, true), result(6, false));

        EvaluationScore score = evaluator.score(results,
                List.of(new LabeledInterval(0, 10), new LabeledInterval(5, 6)));

        assertThat(score).isEqualTo(new EvaluationScore(2, 0, 0));
        assertThat(score.getF1()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should apply the delay per interval when intervals are nested")
    void shouldApplyDelayPerNestedInterval() {
        List<DetectionResult> results = new ArrayList<>();
        for (long ts = 0; ts <= 10; ts++) {
            results.add(result(ts, ts == 6));
        }

        // position 6 of [0, 10] but position 1 of [5, 8]
        EvaluationScore score = new Evaluator(2).score(results,
                List.of(new LabeledInterval(0, 10), new LabeledInterval(5, 8)));

        assertThat(score).isEqualTo(new EvaluationScore(1, 0, 1));
    }

    @Test
    @DisplayName("Should count an interval once however many alarms it holds")
    void shouldAdjustPointsWithinInterval() {
        List<DetectionResult> results = List.of(
                result(10, true), result(11, true), result(12, true), result(13, false));

        EvaluationScore score = evaluator.score(results, List.of(new LabeledInterval(10, 13)));

        assertThat(score).isEqualTo(new EvaluationScore(1, 0, 0));
    }

    @Test
    @DisplayName("Should count every alarm outside the intervals as a false positive")
    void shouldCountFalsePositives() {
        List<DetectionResult> results = List.of(
                result(1, true), result(2, false), result(3, true), result(10, true));

        EvaluationScore score = evaluator.score(results, List.of(new LabeledInterval(10, 12)));

        assertThat(score).isEqualTo(new EvaluationScore(1, 2, 0));
        assertThat(score.getPrecision()).isCloseTo(1.0 / 3, within(1e-12));
    }

    @Test
    @DisplayName("Should count a missed interval as a false negative")
    void shouldCountFalseNegatives() {
        List<DetectionResult> results = List.of(result(1, false), result(2, false), result(3, false));

        EvaluationScore score = evaluator.score(results,
                List.of(new LabeledInterval(2, 3), new LabeledInterval(100, 200)));

        assertThat(score).isEqualTo(new EvaluationScore(0, 0, 2));
        assertThat(score.getRecall()).isZero();
        assertThat(score.getF1()).isZero();
    }

    @Test
    @DisplayName("Should only credit alarms within the detection delay")
    void shouldApplyDetectionDelay() {
        List<DetectionResult> results = new ArrayList<>();
        for (long ts = 10; ts <= 20; ts++) {
            results.add(result(ts, ts == 15));
        }
        List<LabeledInterval> truth = List.of(new LabeledInterval(10, 20));

        assertThat(new Evaluator(3).score(results, truth)).isEqualTo(new EvaluationScore(0, 0, 1));
        assertThat(new Evaluator(5).score(results, truth)).isEqualTo(new EvaluationScore(1, 0, 0));
        assertThat(evaluator.score(results, truth)).isEqualTo(new EvaluationScore(1, 0, 0));
    }

    @Test
    @DisplayName("Should take the delay from evaluation settings")
    void shouldReadDelayFromSettings() {
        EvaluationSettings settings = new EvaluationSettings();
        settings.setDetectionDelay(2);

        assertThat(new Evaluator(settings).getDetectionDelay()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should ignore imputed detections")
    void shouldIgnoreImputed() {
        DetectionResult imputed = DetectionResult.builder()
                .timestamp(1).value(0).anomaly(true).threshold(1).anomalyThreshold(1).imputed(true).build();

        EvaluationScore score = evaluator.score(List.of(imputed), List.of(new LabeledInterval(1, 1)));

        assertThat(score).isEqualTo(new EvaluationScore(0, 0, 1));
    }

    @Test
    @DisplayName("Should build intervals from runs of positive labels")
    void shouldBuildIntervalsFromLabels() {
        long[] timestamps = { 1, 2, 3, 4, 5, 6 };
        boolean[] labels = { false, true, true, false, false, true };

        assertThat(LabeledInterval.fromLabels(timestamps, labels))
                .containsExactly(new LabeledInterval(2, 3), new LabeledInterval(6, 6));
    }

    @Test
    @DisplayName("Should merge scores by summing counts")
    void shouldMergeScores() {
        EvaluationScore merged = new EvaluationScore(1, 2, 0).merge(new EvaluationScore(3, 0, 1));

        assertThat(merged).isEqualTo(new EvaluationScore(4, 2, 1));
        assertThat(merged.getPrecision()).isCloseTo(4.0 / 6, within(1e-12));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectionResult result(long timestamp, boolean anomaly) {
        return DetectionResult.builder()
                .timestamp(timestamp)
                .value(anomaly ? 100 : 2)
                .anomaly(anomaly)
                .threshold(50)
                .anomalyThreshold(50)
                .build();
    }
}
