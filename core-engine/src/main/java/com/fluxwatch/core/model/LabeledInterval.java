package com.fluxwatch.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Closed time range {@code [start, end]} during which the monitored system is
 * known to be anomalous (ground truth).
 *
 * @since 1.0.0
 */
public final class LabeledInterval implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long start;
    private final long end;

    /**
     * @param start first anomalous timestamp (inclusive)
     * @param end   last anomalous timestamp (inclusive)
     * @throws IllegalArgumentException if {@code end < start}
     */
    public LabeledInterval(long start, long end) {
        if (end < start) {
            throw new IllegalArgumentException(
                    "Interval end must be >= start, got: [" + start + ", " + end + "]");
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Build intervals from point-wise labels: every maximal run of consecutive
     * positive labels becomes one interval spanning the run's first and last
     * timestamps.
     *
     * @param timestamps ordered timestamps
     * @param labels     point labels, parallel to {@code timestamps}
     * @return intervals in timestamp order
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static List<LabeledInterval> fromLabels(long[] timestamps, boolean[] labels) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (timestamps.length != labels.length) {
            throw new IllegalArgumentException("timestamps and labels differ in length: "
                    + timestamps.length + " vs " + labels.length);
        }

        List<LabeledInterval> intervals = new ArrayList<>();
        int runStart = -1;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] && runStart < 0) {
                runStart = i;
            } else if (!labels[i] && runStart >= 0) {
                intervals.add(new LabeledInterval(timestamps[runStart], timestamps[i - 1]));
                runStart = -1;
            }
        }
        if (runStart >= 0) {
            intervals.add(new LabeledInterval(timestamps[runStart], timestamps[labels.length - 1]));
        }
        return intervals;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public boolean contains(long timestamp) {
        return timestamp >= start && timestamp <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LabeledInterval that))
            return false;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
