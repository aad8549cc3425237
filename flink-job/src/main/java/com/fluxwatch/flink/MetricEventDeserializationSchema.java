package com.fluxwatch.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Converts raw Kafka bytes into {@link MetricEvent}s.
 *
 * <p>
 * Expected payload:
 * {@code {"metric": "cpu", "timestamp": 1700000000, "value": 0.42}}. The
 * name of the metric field is configurable. {@code value} may be a number
 * or a numeric string ({@code "NaN"} included, so that the engine's
 * invalid-value policy decides). Malformed messages are logged and dropped
 * by returning {@code null}.
 * </p>
 */
public class MetricEventDeserializationSchema implements DeserializationSchema<MetricEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricEventDeserializationSchema.class);

    private final String metricField;

    private transient ObjectMapper mapper;

    public MetricEventDeserializationSchema(String metricField) {
        this.metricField = Objects.requireNonNull(metricField, "metricField must not be null");
    }

    @Override
    public MetricEvent deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            JsonNode node = objectMapper().readTree(message);
            JsonNode metric = node.get(metricField);
            JsonNode timestamp = node.get("timestamp");
            JsonNode value = node.get("value");
            if (metric == null || !metric.isTextual() || metric.asText().isBlank()) {
                LOG.warn("Metric event without '{}' field, skipping", metricField);
                return null;
            }
            if (timestamp == null || !timestamp.canConvertToLong() || value == null || value.isNull()) {
                LOG.warn("Metric event for '{}' without a valid timestamp/value, skipping", metric.asText());
                return null;
            }
            double parsed = value.isNumber() ? value.doubleValue() : Double.parseDouble(value.asText());
            return new MetricEvent(metric.asText(), timestamp.asLong(), parsed);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize metric event, skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MetricEvent nextElement) {
        return false;
    }

    @Override
    public TypeInformation<MetricEvent> getProducedType() {
        return TypeInformation.of(MetricEvent.class);
    }

    public String getMetricField() {
        return metricField;
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return mapper;
    }
}
