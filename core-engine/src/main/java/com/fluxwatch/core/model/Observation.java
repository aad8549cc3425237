package com.fluxwatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single scalar telemetry sample.
 *
 * <p>
 * Streams of observations are totally ordered by {@link #getTimestamp()},
 * an epoch-like ordinal key (typically seconds since the Unix epoch).
 * Observations synthesised by the preprocessor to fill a short gap carry
 * {@link #isImputed()} {@code == true}.
 * </p>
 *
 * <p>
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Observation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long timestamp;
    private final double value;
    private final boolean imputed;

    public Observation(long timestamp, double value) {
        this(timestamp, value, false);
    }

    public Observation(long timestamp, double value, boolean imputed) {
        this.timestamp = timestamp;
        this.value = value;
        this.imputed = imputed;
    }

    /**
     * Create a gap-fill observation.
     *
     * @param timestamp the missing sample's timestamp
     * @param value     the imputed value
     * @return an observation flagged as imputed
     */
    public static Observation imputed(long timestamp, double value) {
        return new Observation(timestamp, value, true);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public boolean isImputed() {
        return imputed;
    }

    /**
     * Return a copy of this observation carrying a different value.
     *
     * @param newValue the replacement value
     * @return new observation with the same timestamp and imputed flag
     */
    public Observation withValue(double newValue) {
        return new Observation(timestamp, newValue, imputed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && imputed == that.imputed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, imputed);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                (imputed ? ", imputed" : "") +
                '}';
    }
}
