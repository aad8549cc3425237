package com.fluxwatch.core.evaluation;

import com.fluxwatch.core.config.EvaluationSettings;
import com.fluxwatch.core.model.DetectionResult;
import com.fluxwatch.core.model.EvaluationScore;
import com.fluxwatch.core.model.LabeledInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Scores detections against labelled anomaly intervals with point
 * adjustment.
 *
 * <h3>Counting</h3>
 * <ul>
 * <li>An interval containing at least one crediting alarm is one true
 * positive, however many alarms it contains.</li>
 * <li>An interval with no crediting alarm is one false negative.</li>
 * <li>Every alarm outside all intervals is one false positive.</li>
 * </ul>
 *
 * <p>
 * With {@code detectionDelay >= 0}, only alarms among the first
 * {@code detectionDelay + 1} detections inside an interval credit it; later
 * alarms in the same interval count neither way. Imputed detections are
 * ignored.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    /** No delay bound. */
    public static final int UNLIMITED_DELAY = -1;

    private final int detectionDelay;

    public Evaluator() {
        this(UNLIMITED_DELAY);
    }

    public Evaluator(EvaluationSettings settings) {
        this(Objects.requireNonNull(settings, "EvaluationSettings must not be null").getDetectionDelay());
    }

    /**
     * @param detectionDelay maximum number of detections after an interval
     *                       starts that may still credit it, or a negative
     *                       value for no bound
     */
    public Evaluator(int detectionDelay) {
        this.detectionDelay = detectionDelay;
    }

    /**
     * Score one stream.
     *
     * @param results   detections in stream order
     * @param intervals ground-truth anomaly intervals
     * @return the point-adjusted score
     */
    public EvaluationScore score(List<DetectionResult> results, Collection<LabeledInterval> intervals) {
        Objects.requireNonNull(results, "results must not be null");
        Objects.requireNonNull(intervals, "intervals must not be null");

        List<LabeledInterval> truth = new ArrayList<>(intervals);
        int[] seen = new int[truth.size()];
        boolean[] credited = new boolean[truth.size()];
        int falsePositive = 0;

        for (DetectionResult result : results) {
            if (result.isImputed()) {
                continue;
            }
            boolean inside = false;
            for (int i = 0; i < truth.size(); i++) {
                if (!truth.get(i).contains(result.getTimestamp())) {
                    continue;
                }
                inside = true;
                int position = seen[i]++;
                if (result.isAnomaly() && withinDelay(position)) {
                    credited[i] = true;
                }
            }
            if (!inside && result.isAnomaly()) {
                falsePositive++;
            }
        }

        int truePositive = 0;
        for (boolean c : credited) {
            if (c) {
                truePositive++;
            }
        }
        EvaluationScore score = new EvaluationScore(truePositive, falsePositive, truth.size() - truePositive);
        LOG.debug("Scored {} detection(s) against {} interval(s): {}", results.size(), truth.size(), score);
        return score;
    }

    private boolean withinDelay(int position) {
        return detectionDelay < 0 || position <= detectionDelay;
    }

    public int getDetectionDelay() {
        return detectionDelay;
    }
}
