package com.fluxwatch.flink;

import com.fluxwatch.core.model.Observation;

import java.io.Serializable;
import java.util.Objects;

/**
 * One metric sample as read from Kafka.
 *
 * <p>
 * Mutable POJO so Flink can treat it as a POJO type.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String metric;
    private long timestamp;
    private double value;

    public MetricEvent() {
    }

    public MetricEvent(String metric, long timestamp, double value) {
        this.metric = metric;
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * @return the sample as an engine observation
     */
    public Observation toObservation() {
        return new Observation(timestamp, value);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricEvent that))
            return false;
        return timestamp == that.timestamp
                && Double.compare(value, that.value) == 0
                && Objects.equals(metric, that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, timestamp, value);
    }

    @Override
    public String toString() {
        return "MetricEvent{metric='" + metric + "', timestamp=" + timestamp + ", value=" + value + '}';
    }
}
