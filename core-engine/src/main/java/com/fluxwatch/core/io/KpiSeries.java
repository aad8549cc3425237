package com.fluxwatch.core.io;

import com.fluxwatch.core.model.LabeledInterval;
import com.fluxwatch.core.model.Observation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One labelled KPI of an offline dataset, sorted by timestamp.
 *
 * <p>
 * The first {@link #getTrainLength()} rows form the training segment used
 * for calibration; the remaining rows are the test segment that is scored.
 * Rows flagged missing in the dataset are carried as imputed observations.
 * </p>
 *
 * @since 1.0.0
 */
public final class KpiSeries {

    private final String kpiId;
    private final List<Observation> observations;
    private final boolean[] labels;
    private final int trainLength;

    public KpiSeries(String kpiId, List<Observation> observations, boolean[] labels, int trainLength) {
        this.kpiId = Objects.requireNonNull(kpiId, "kpiId must not be null");
        Objects.requireNonNull(observations, "observations must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (labels.length != observations.size()) {
            throw new IllegalArgumentException("KPI '" + kpiId + "': " + labels.length + " label(s) for "
                    + observations.size() + " observation(s)");
        }
        if (trainLength < 0 || trainLength > observations.size()) {
            throw new IllegalArgumentException("KPI '" + kpiId + "': train length " + trainLength
                    + " outside [0, " + observations.size() + "]");
        }
        this.observations = Collections.unmodifiableList(observations);
        this.labels = labels.clone();
        this.trainLength = trainLength;
    }

    /**
     * @return labelled anomaly intervals of the test segment
     */
    public List<LabeledInterval> getTestIntervals() {
        int testLength = observations.size() - trainLength;
        long[] timestamps = new long[testLength];
        for (int i = 0; i < testLength; i++) {
            timestamps[i] = observations.get(trainLength + i).getTimestamp();
        }
        return LabeledInterval.fromLabels(timestamps, Arrays.copyOfRange(labels, trainLength, labels.length));
    }

    public String getKpiId() {
        return kpiId;
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public boolean[] getLabels() {
        return labels.clone();
    }

    public int getTrainLength() {
        return trainLength;
    }

    public int size() {
        return observations.size();
    }

    @Override
    public String toString() {
        return "KpiSeries{kpiId='" + kpiId + "', size=" + observations.size() + ", trainLength=" + trainLength + '}';
    }
}
