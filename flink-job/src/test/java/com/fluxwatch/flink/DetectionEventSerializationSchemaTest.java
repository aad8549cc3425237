package com.fluxwatch.flink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fluxwatch.core.model.DetectionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionEventSerializationSchema}.
 */
class DetectionEventSerializationSchemaTest {

    private final DetectionEventSerializationSchema schema = new DetectionEventSerializationSchema();

    @Test
    @DisplayName("Should write every detection field as JSON")
    void shouldSerializeEvent() throws Exception {
        DetectionResult result = DetectionResult.builder()
                .timestamp(1_700_000_060L)
                .value(97.5)
                .anomaly(true)
                .threshold(80.0)
                .anomalyThreshold(82.5)
                .tailShape(0.1)
                .tailScale(3.0)
                .imputed(false)
                .build();
        DetectionEvent event = new DetectionEvent("cpu", result, Instant.parse("2024-01-01T00:00:00Z"));

        JsonNode json = new ObjectMapper().readTree(schema.serialize(event));

        assertThat(json.get("metric").asText()).isEqualTo("cpu");
        assertThat(json.get("timestamp").asLong()).isEqualTo(1_700_000_060L);
        assertThat(json.get("value").asDouble()).isEqualTo(97.5);
        assertThat(json.get("anomaly").asBoolean()).isTrue();
        assertThat(json.get("threshold").asDouble()).isEqualTo(80.0);
        assertThat(json.get("anomalyThreshold").asDouble()).isEqualTo(82.5);
        assertThat(json.get("tailShape").asDouble()).isEqualTo(0.1);
        assertThat(json.get("tailScale").asDouble()).isEqualTo(3.0);
        assertThat(json.get("imputed").asBoolean()).isFalse();
        assertThat(json.get("detectedAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("Should write undefined thresholds as null")
    void shouldWriteNonFiniteAsNull() throws Exception {
        DetectionResult result = DetectionResult.builder()
                .timestamp(1_700_000_120L)
                .value(Double.NaN)
                .anomaly(false)
                .threshold(Double.NaN)
                .anomalyThreshold(Double.POSITIVE_INFINITY)
                .tailShape(0.0)
                .tailScale(2.0)
                .imputed(true)
                .build();

        JsonNode json = new ObjectMapper().readTree(schema.serialize(event("cpu", result)));

        assertThat(json.get("value").isNull()).isTrue();
        assertThat(json.get("threshold").isNull()).isTrue();
        assertThat(json.get("anomalyThreshold").isNull()).isTrue();
        assertThat(json.get("tailShape").asDouble()).isEqualTo(0.0);
        assertThat(json.get("tailScale").asDouble()).isEqualTo(2.0);
        assertThat(json.get("imputed").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Should key records by metric name")
    void shouldKeyByMetric() {
        DetectionResult result = DetectionResult.builder()
                .timestamp(1L)
                .value(1.0)
                .threshold(2.0)
                .anomalyThreshold(2.0)
                .build();

        byte[] key = DetectionEventSerializationSchema.keySchema().serialize(event("disk-io", result));

        assertThat(new String(key, StandardCharsets.UTF_8)).isEqualTo("disk-io");
    }

    // Helpers

    private static DetectionEvent event(String metric, DetectionResult result) {
        return new DetectionEvent(metric, result, Instant.parse("2024-01-01T00:00:00Z"));
    }
}
