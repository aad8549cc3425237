package com.fluxwatch.flink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Writes a {@link DetectionEvent} as a JSON record for the Kafka output topic.
 *
 * <p>Thresholds and tail parameters are not defined for imputed points or an
 * exponential tail fit; non-finite doubles are written as JSON {@code null}
 * so that downstream consumers always read valid numbers. {@code detectedAt}
 * is an ISO-8601 string.
 *
 * <p>{@link #keySchema()} keys records by metric, which keeps each metric's
 * detections ordered on a single partition.
 */
public class DetectionEventSerializationSchema implements SerializationSchema<DetectionEvent> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectionEventSerializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(DetectionEvent event) {
        try {
            ObjectMapper om = objectMapper();
            ObjectNode node = om.createObjectNode();
            node.put("metric", event.getMetric());
            node.put("timestamp", event.getTimestamp());
            putFinite(node, "value", event.getValue());
            node.put("anomaly", event.isAnomaly());
            putFinite(node, "threshold", event.getThreshold());
            putFinite(node, "anomalyThreshold", event.getAnomalyThreshold());
            putFinite(node, "tailShape", event.getTailShape());
            putFinite(node, "tailScale", event.getTailScale());
            node.put("imputed", event.isImputed());
            node.putPOJO("detectedAt", event.getDetectedAt());
            return om.writeValueAsBytes(node);
        } catch (Exception e) {
            LOG.error("Failed to serialize detection event for '{}' at {}: {}",
                    event.getMetric(), event.getTimestamp(), e.getMessage(), e);
            return new byte[0];
        }
    }

    /**
     * Schema for the Kafka record key: the metric name as UTF-8.
     */
    public static SerializationSchema<DetectionEvent> keySchema() {
        return event -> event.getMetric() == null
                ? null
                : event.getMetric().getBytes(StandardCharsets.UTF_8);
    }

    private static void putFinite(ObjectNode node, String field, double value) {
        if (Double.isFinite(value)) {
            node.put(field, value);
        } else {
            node.putNull(field);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
