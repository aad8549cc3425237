package com.fluxwatch.core.preprocess;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Smoothed fluctuation of the EWMA prediction error.
 *
 * <p>
 * With window {@code w} and smoothing factor {@code α}:
 * </p>
 * <ol>
 * <li>prediction {@code P[i]} = EWMA of the previous {@code w} values,
 * seeded with the oldest one;</li>
 * <li>prediction error {@code E[i] = x[i] - P[i]};</li>
 * <li>fluctuation
 * {@code F[i] = max(std(E[i-w..i]) - std(E[i-w..i-1]), 0)}, with population
 * standard deviations.</li>
 * </ol>
 *
 * <p>
 * {@code F[i]} measures how much the newest error widens the recent error
 * spread, so a single spike scores high while a stable periodic pattern or
 * a settled level scores near zero. The first {@code 2w} outputs are 0
 * while the error history fills up.
 * </p>
 *
 * @since 1.0.0
 */
public class FluctuationTransform implements ValueTransform {

    private static final long serialVersionUID = 1L;

    private final int window;
    private final double alpha;
    private final ArrayDeque<Double> values;
    private final ArrayDeque<Double> errors;

    /**
     * @param window history length {@code w} (&gt;= 2)
     * @param alpha  EWMA smoothing factor, in (0, 1]
     */
    public FluctuationTransform(int window, double alpha) {
        if (window < 2) {
            throw new IllegalArgumentException("Fluctuation window must be >= 2, got: " + window);
        }
        if (!(alpha > 0 && alpha <= 1)) {
            throw new IllegalArgumentException("EWMA alpha must be in (0, 1], got: " + alpha);
        }
        this.window = window;
        this.alpha = alpha;
        this.values = new ArrayDeque<>(window);
        this.errors = new ArrayDeque<>(window + 1);
    }

    @Override
    public double apply(double value) {
        if (values.size() == window) {
            errors.addLast(value - ewma());
            if (errors.size() > window + 1) {
                errors.removeFirst();
            }
        }
        values.addLast(value);
        if (values.size() > window) {
            values.removeFirst();
        }

        if (errors.size() < window + 1) {
            return 0.0;
        }
        return Math.max(std(errors, window + 1) - std(errors, window), 0.0);
    }

    private double ewma() {
        Iterator<Double> it = values.iterator();
        double smoothed = it.next();
        while (it.hasNext()) {
            smoothed = alpha * it.next() + (1 - alpha) * smoothed;
        }
        return smoothed;
    }

    /** Population std of the first {@code count} elements. */
    private static double std(ArrayDeque<Double> deque, int count) {
        double sum = 0;
        double sumSq = 0;
        int i = 0;
        for (Iterator<Double> it = deque.iterator(); it.hasNext() && i < count; i++) {
            double e = it.next();
            sum += e;
            sumSq += e * e;
        }
        double mean = sum / count;
        return Math.sqrt(Math.max(sumSq / count - mean * mean, 0.0));
    }

    @Override
    public TransformType getType() {
        return TransformType.FLUCTUATION;
    }

    public int getWindow() {
        return window;
    }

    public double getAlpha() {
        return alpha;
    }
}
