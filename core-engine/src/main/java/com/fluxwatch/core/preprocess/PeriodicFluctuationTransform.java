package com.fluxwatch.core.preprocess;

/**
 * Fluctuation with a second, periodic smoothing pass.
 *
 * <p>
 * The first pass is the {@link FluctuationTransform} score {@code F[i]}.
 * The second pass compares it with the same phase of earlier periods:
 * </p>
 * <ol>
 * <li>local maximum {@code L[j] = max(F[j-h..j+h])} over a centred drift
 * window of half-width {@code h}, known once {@code F[j+h]} arrives;</li>
 * <li>score {@code S[i] = max(F[i] - max(L[i-p], L[i-2p], ..., L[i-(k-1)p]), 0)}
 * for period {@code p} and period window {@code k}.</li>
 * </ol>
 *
 * <p>
 * A daily spike that recurs at the same phase, give or take {@code h}
 * samples, is absorbed by its own history; only fluctuation that exceeds
 * every recent period scores. Outputs are 0 until {@code k-1} full periods
 * of local maxima exist.
 * </p>
 *
 * <p>
 * {@link #discardLast()} removes the newest {@code F} from the local maxima,
 * so a flagged point does not raise the reference of later periods.
 * </p>
 *
 * @since 1.0.0
 */
public class PeriodicFluctuationTransform implements ValueTransform {

    private static final long serialVersionUID = 1L;

    private final FluctuationTransform firstPass;
    private final int period;
    private final int periodWindow;
    private final int halfDriftWindow;

    /** Last {@code 2h + 1} first-pass scores, NaN once discarded. */
    private final double[] recentScores;

    /** Local maxima by index, wide enough for {@code k-1} periods. */
    private final double[] localMaxima;

    private long index = -1;

    /**
     * @param window          first-pass history length (&gt;= 2)
     * @param alpha           first-pass EWMA factor, in (0, 1]
     * @param period          samples per period (&gt;= halfDriftWindow, &gt;= 1)
     * @param periodWindow    number of periods compared, current one included
     *                        (&gt;= 2)
     * @param halfDriftWindow half-width of the local-maximum window (&gt;= 0)
     */
    public PeriodicFluctuationTransform(int window, double alpha, int period, int periodWindow,
            int halfDriftWindow) {
        if (halfDriftWindow < 0) {
            throw new IllegalArgumentException("Half drift window must be >= 0, got: " + halfDriftWindow);
        }
        if (period < 1 || period < halfDriftWindow) {
            throw new IllegalArgumentException("Period must be >= 1 and >= half drift window ("
                    + halfDriftWindow + "), got: " + period);
        }
        if (periodWindow < 2) {
            throw new IllegalArgumentException("Period window must be >= 2, got: " + periodWindow);
        }
        this.firstPass = new FluctuationTransform(window, alpha);
        this.period = period;
        this.periodWindow = periodWindow;
        this.halfDriftWindow = halfDriftWindow;
        this.recentScores = new double[2 * halfDriftWindow + 1];
        this.localMaxima = new double[period * (periodWindow - 1) + 1];
    }

    @Override
    public double apply(double value) {
        double score = firstPass.apply(value);
        index++;
        recentScores[slot(index, recentScores.length)] = score;
        updateLocalMaximum();

        long oldest = index - (long) period * (periodWindow - 1);
        if (oldest < halfDriftWindow) {
            return 0.0;
        }
        double reference = Double.NaN;
        for (long j = index - period; j >= oldest; j -= period) {
            reference = nanMax(reference, localMaxima[slot(j, localMaxima.length)]);
        }
        // every earlier maximum discarded: compare against no fluctuation
        return Math.max(score - (Double.isNaN(reference) ? 0.0 : reference), 0.0);
    }

    /**
     * Exclude the newest first-pass score from every later local maximum.
     */
    @Override
    public void discardLast() {
        if (index < 0) {
            return;
        }
        recentScores[slot(index, recentScores.length)] = Double.NaN;
        updateLocalMaximum();
    }

    /** Recompute {@code L[index - h]} from the current drift window. */
    private void updateLocalMaximum() {
        long centre = index - halfDriftWindow;
        if (centre < halfDriftWindow) {
            return;
        }
        double max = Double.NaN;
        for (double s : recentScores) {
            max = nanMax(max, s);
        }
        localMaxima[slot(centre, localMaxima.length)] = max;
    }

    private static double nanMax(double a, double b) {
        if (Double.isNaN(a)) {
            return b;
        }
        return Double.isNaN(b) ? a : Math.max(a, b);
    }

    private static int slot(long i, int length) {
        return (int) (i % length);
    }

    @Override
    public TransformType getType() {
        return TransformType.PERIODIC_FLUCTUATION;
    }

    public int getPeriod() {
        return period;
    }

    public int getPeriodWindow() {
        return periodWindow;
    }

    public int getHalfDriftWindow() {
        return halfDriftWindow;
    }
}
