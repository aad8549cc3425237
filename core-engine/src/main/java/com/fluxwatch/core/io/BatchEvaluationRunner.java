package com.fluxwatch.core.io;

import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.config.EngineConfigLoader;
import com.fluxwatch.core.evaluation.Evaluator;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.EvaluationScore;
import com.fluxwatch.core.model.Observation;
import com.fluxwatch.core.pipeline.MetricMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Offline evaluation of a labelled multi-KPI dataset.
 *
 * <p>
 * Every KPI runs through its own {@link MetricMonitor}, calibrated on the
 * KPI's training segment and scored on its test segment. KPIs are
 * independent and run concurrently on a fixed pool of
 * {@code workerThreads}. A KPI that fails (for instance because its training
 * segment is too short to calibrate) is reported and excluded from the
 * overall score; the others still complete.
 * </p>
 *
 * <pre>
 * java -cp core-engine.jar com.fluxwatch.core.io.BatchEvaluationRunner dataset.csv [engine.yml]
 * </pre>
 *
 * @since 1.0.0
 */
public class BatchEvaluationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BatchEvaluationRunner.class);

    private final EngineConfig config;
    private final Evaluator evaluator;

    /**
     * @param config engine configuration; validated here
     */
    public BatchEvaluationRunner(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        config.validate();
        this.evaluator = new Evaluator(config.getEvaluation());
    }

    /**
     * Evaluate every KPI of a dataset.
     *
     * @param dataset series keyed by KPI id
     * @return per-KPI reports and the merged score
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public BatchReport evaluate(Map<String, KpiSeries> dataset) throws InterruptedException {
        Objects.requireNonNull(dataset, "dataset must not be null");
        if (dataset.isEmpty()) {
            return new BatchReport(Collections.emptyMap());
        }
        int threads = Math.min(config.getEvaluation().getWorkerThreads(), dataset.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        LOG.info("Evaluating {} KPI(s) on {} worker thread(s)", dataset.size(), threads);
        try {
            List<Callable<KpiReport>> tasks = new ArrayList<>(dataset.size());
            for (KpiSeries series : dataset.values()) {
                tasks.add(() -> evaluate(series));
            }
            List<Future<KpiReport>> futures = pool.invokeAll(tasks);

            Map<String, KpiReport> reports = new LinkedHashMap<>();
            int i = 0;
            for (KpiSeries series : dataset.values()) {
                reports.put(series.getKpiId(), collect(series.getKpiId(), futures.get(i++)));
            }
            return new BatchReport(reports);
        } finally {
            pool.shutdownNow();
        }
    }

    private static KpiReport collect(String kpiId, Future<KpiReport> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("KPI '{}' failed: {}", kpiId, cause.getMessage(), cause);
            return KpiReport.failed(kpiId, cause.getMessage());
        }
    }

    /**
     * Evaluate one KPI on the calling thread.
     *
     * @param series the KPI
     * @return its report
     */
    public KpiReport evaluate(KpiSeries series) {
        EngineConfig kpiConfig = new EngineConfig();
        kpiConfig.setDetector(config.getDetector().withCalibrationSize(series.getTrainLength()));
        kpiConfig.setPreprocessing(config.getPreprocessing());
        kpiConfig.setEvaluation(config.getEvaluation());

        MetricMonitor monitor = new MetricMonitor(series.getKpiId(), kpiConfig);
        List<DetectionResult> results = new ArrayList<>();
        for (Observation observation : series.getObservations()) {
            results.addAll(monitor.process(observation));
        }
        results.addAll(monitor.finish());

        EvaluationScore score = evaluator.score(results, series.getTestIntervals());
        long alarms = results.stream().filter(DetectionResult::isAnomaly).count();
        LOG.info("KPI '{}': {} detection(s), {} alarm(s), {}", series.getKpiId(), results.size(), alarms, score);
        return KpiReport.succeeded(series.getKpiId(), score, results.size(), alarms,
                monitor.getState().getAnomalyThreshold());
    }

    // ---------------------------------------------------------------
    // Entry point
    // ---------------------------------------------------------------

    public static void main(String[] args) throws IOException, InterruptedException {
        if (args.length < 1) {
            System.err.println("Usage: BatchEvaluationRunner <dataset.csv> [engine.yml]");
            System.exit(2);
        }
        EngineConfig config = args.length > 1 ? EngineConfigLoader.fromFile(args[1]) : EngineConfigLoader.load();
        BatchReport report = new BatchEvaluationRunner(config).evaluate(KpiDatasetReader.read(Path.of(args[0])));
        report.getReports().values().forEach(r -> LOG.info("{}", r));
        LOG.info("Overall: {} ({} failed KPI(s))", report.getOverall(), report.getFailures().size());
    }

    // ---------------------------------------------------------------
    // Reports
    // ---------------------------------------------------------------

    /**
     * Outcome of one KPI.
     */
    public static final class KpiReport {

        private final String kpiId;
        private final EvaluationScore score;
        private final int detectionCount;
        private final long alarmCount;
        private final double finalAnomalyThreshold;
        private final String error;

        private KpiReport(String kpiId, EvaluationScore score, int detectionCount, long alarmCount,
                double finalAnomalyThreshold, String error) {
            this.kpiId = kpiId;
            this.score = score;
            this.detectionCount = detectionCount;
            this.alarmCount = alarmCount;
            this.finalAnomalyThreshold = finalAnomalyThreshold;
            this.error = error;
        }

        static KpiReport succeeded(String kpiId, EvaluationScore score, int detectionCount, long alarmCount,
                double finalAnomalyThreshold) {
            return new KpiReport(kpiId, score, detectionCount, alarmCount, finalAnomalyThreshold, null);
        }

        static KpiReport failed(String kpiId, String error) {
            return new KpiReport(kpiId, EvaluationScore.empty(), 0, 0, Double.NaN,
                    error != null ? error : "unknown error");
        }

        public boolean isFailed() {
            return error != null;
        }

        public String getKpiId() {
            return kpiId;
        }

        public EvaluationScore getScore() {
            return score;
        }

        public int getDetectionCount() {
            return detectionCount;
        }

        public long getAlarmCount() {
            return alarmCount;
        }

        public double getFinalAnomalyThreshold() {
            return finalAnomalyThreshold;
        }

        public String getError() {
            return error;
        }

        @Override
        public String toString() {
            if (isFailed()) {
                return "KpiReport{kpiId='" + kpiId + "', error='" + error + "'}";
            }
            return "KpiReport{kpiId='" + kpiId + "', detections=" + detectionCount + ", alarms=" + alarmCount
                    + ", anomalyThreshold=" + finalAnomalyThreshold + ", score=" + score + '}';
        }
    }

    /**
     * Outcome of a whole dataset.
     */
    public static final class BatchReport {

        private final Map<String, KpiReport> reports;
        private final EvaluationScore overall;

        BatchReport(Map<String, KpiReport> reports) {
            this.reports = Collections.unmodifiableMap(reports);
            this.overall = reports.values().stream()
                    .filter(r -> !r.isFailed())
                    .map(KpiReport::getScore)
                    .reduce(EvaluationScore.empty(), EvaluationScore::merge);
        }

        public Map<String, KpiReport> getReports() {
            return reports;
        }

        /**
         * @return counts summed over every successful KPI
         */
        public EvaluationScore getOverall() {
            return overall;
        }

        public List<KpiReport> getFailures() {
            return reports.values().stream().filter(KpiReport::isFailed).toList();
        }
    }
}
