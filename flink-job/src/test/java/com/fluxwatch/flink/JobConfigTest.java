package com.fluxwatch.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should fall back to defaults")
    void shouldUseDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaInputTopic()).isEqualTo("observations");
        assertThat(config.getKafkaOutputTopic()).isEqualTo("detections");
        assertThat(config.getKafkaGroupId()).isEqualTo("fluxwatch");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getEngineConfigPath()).isEmpty();
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getMetricKeyField()).isEqualTo("metric");
        assertThat(config.isEmitAllResults()).isFalse();
    }

    @Test
    @DisplayName("Should carry overridden values")
    void shouldOverrideValues() {
        JobConfig config = new JobConfig.Builder()
                .kafkaInputTopic("kpi-in")
                .parallelism(4)
                .metricKeyField("kpi")
                .emitAllResults(true)
                .engineConfigPath("/etc/fluxwatch/engine.yml")
                .build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("kpi-in");
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getMetricKeyField()).isEqualTo("kpi");
        assertThat(config.isEmitAllResults()).isTrue();
        assertThat(config.toString()).contains("/etc/fluxwatch/engine.yml");
    }

    @Test
    @DisplayName("Should reject out-of-range numbers")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject blank names")
    void shouldRejectBlankNames() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaOutputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaOutputTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().metricKeyField(null).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
