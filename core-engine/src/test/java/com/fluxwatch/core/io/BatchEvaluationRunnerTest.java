package com.fluxwatch.core.io;

import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.model.EvaluationScore;
import com.fluxwatch.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BatchEvaluationRunner}.
 */
class BatchEvaluationRunnerTest {

    private EngineConfig config;

    @BeforeEach
    void setUp() {
        config = new EngineConfig();
        config.getEvaluation().setWorkerThreads(2);
    }

    @Test
    @DisplayName("Should credit a labelled spike in the test segment")
    void shouldDetectLabelledSpike() {
        BatchEvaluationRunner.KpiReport report = new BatchEvaluationRunner(config).evaluate(spikySeries("a"));

        assertThat(report.isFailed()).isFalse();
        assertThat(report.getDetectionCount()).isEqualTo(100);
        assertThat(report.getScore().getTruePositive()).isEqualTo(1);
        assertThat(report.getScore().getFalseNegative()).isZero();
        assertThat(report.getAlarmCount()).isGreaterThanOrEqualTo(1);
        assertThat(report.getFinalAnomalyThreshold()).isFinite();
    }

    @Test
    @DisplayName("Should isolate a KPI that cannot be calibrated")
    void shouldIsolateFailedKpi() throws InterruptedException {
        Map<String, KpiSeries> dataset = new LinkedHashMap<>();
        dataset.put("a", spikySeries("a"));
        dataset.put("b", shortSeries("b"));

        BatchEvaluationRunner.BatchReport batch = new BatchEvaluationRunner(config).evaluate(dataset);

        assertThat(batch.getReports()).containsOnlyKeys("a", "b");
        assertThat(batch.getFailures()).extracting(BatchEvaluationRunner.KpiReport::getKpiId).containsExactly("b");
        assertThat(batch.getReports().get("b").getError()).contains("calibrationSize");
        EvaluationScore a = batch.getReports().get("a").getScore();
        assertThat(batch.getOverall()).isEqualTo(a);
    }

    @Test
    @DisplayName("Should return an empty report for an empty dataset")
    void shouldHandleEmptyDataset() throws InterruptedException {
        BatchEvaluationRunner.BatchReport batch = new BatchEvaluationRunner(config).evaluate(new LinkedHashMap<>());

        assertThat(batch.getReports()).isEmpty();
        assertThat(batch.getOverall()).isEqualTo(EvaluationScore.empty());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** 200 training points, 100 test points with a labelled spike at index 250. */
    private static KpiSeries spikySeries(String id) {
        Random random = new Random(42);
        List<Observation> observations = new ArrayList<>();
        boolean[] labels = new boolean[300];
        for (int i = 0; i < 300; i++) {
            double value = i == 250 ? 100.0 : 5 + random.nextGaussian() * 0.5;
            observations.add(new Observation(i * 60L, value));
            labels[i] = i == 250;
        }
        return new KpiSeries(id, observations, labels, 200);
    }

    private static KpiSeries shortSeries(String id) {
        List<Observation> observations = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            observations.add(new Observation(i * 60L, 1.0 + i % 3));
        }
        return new KpiSeries(id, observations, new boolean[30], 5);
    }
}
