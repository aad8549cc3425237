package com.fluxwatch.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration of the FluxWatch Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * is configured the same way in a container, a Kubernetes deployment or a
 * shell. Detection settings themselves live in the engine YAML file pointed
 * to by {@code ENGINE_CONFIG_PATH}.
 * </p>
 *
 * <h3>Environment</h3>
 * <table>
 * <caption>Variables</caption>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>localhost:9092</td></tr>
 * <tr><td>{@code KAFKA_INPUT_TOPIC}</td><td>observations</td></tr>
 * <tr><td>{@code KAFKA_OUTPUT_TOPIC}</td><td>detections</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>fluxwatch</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>1</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>60000</td></tr>
 * <tr><td>{@code ENGINE_CONFIG_PATH}</td><td>classpath engine.yml</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>8080</td></tr>
 * <tr><td>{@code METRIC_KEY_FIELD}</td><td>metric</td></tr>
 * <tr><td>{@code EMIT_ALL_RESULTS}</td><td>false</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kafkaBootstrapServers;
    private final String kafkaInputTopic;
    private final String kafkaOutputTopic;
    private final String kafkaGroupId;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String engineConfigPath;
    private final int healthPort;
    private final String metricKeyField;
    private final boolean emitAllResults;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaInputTopic = b.kafkaInputTopic;
        this.kafkaOutputTopic = b.kafkaOutputTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.engineConfigPath = b.engineConfigPath;
        this.healthPort = b.healthPort;
        this.metricKeyField = b.metricKeyField;
        this.emitAllResults = b.emitAllResults;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaInputTopic(env("KAFKA_INPUT_TOPIC", "observations"))
                    .kafkaOutputTopic(env("KAFKA_OUTPUT_TOPIC", "detections"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "fluxwatch"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .engineConfigPath(env("ENGINE_CONFIG_PATH", ""))
                    .healthPort(Integer.parseInt(env("HEALTH_PORT", "8080")))
                    .metricKeyField(env("METRIC_KEY_FIELD", "metric"))
                    .emitAllResults(Boolean.parseBoolean(env("EMIT_ALL_RESULTS", "false")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaInputTopic() {
        return kafkaInputTopic;
    }

    public String getKafkaOutputTopic() {
        return kafkaOutputTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /**
     * @return engine YAML path, blank when the classpath default is used
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public int getHealthPort() {
        return healthPort;
    }

    public String getMetricKeyField() {
        return metricKeyField;
    }

    public boolean isEmitAllResults() {
        return emitAllResults;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}; {@link #build()} checks ranges
     * and rejects blank names.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaInputTopic = "observations";
        private String kafkaOutputTopic = "detections";
        private String kafkaGroupId = "fluxwatch";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String engineConfigPath = "";
        private int healthPort = 8080;
        private String metricKeyField = "metric";
        private boolean emitAllResults;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.kafkaInputTopic = v;
            return this;
        }

        public Builder kafkaOutputTopic(String v) {
            this.kafkaOutputTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder metricKeyField(String v) {
            this.metricKeyField = v;
            return this;
        }

        public Builder emitAllResults(boolean v) {
            this.emitAllResults = v;
            return this;
        }

        /**
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaInputTopic, "kafkaInputTopic");
            requireNonBlank(kafkaOutputTopic, "kafkaOutputTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");
            requireNonBlank(metricKeyField, "metricKeyField");
            Objects.requireNonNull(engineConfigPath, "engineConfigPath must not be null");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaInputTopic='" + kafkaInputTopic + '\'' +
                ", kafkaOutputTopic='" + kafkaOutputTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", engineConfigPath='" + engineConfigPath + '\'' +
                ", healthPort=" + healthPort +
                ", metricKeyField='" + metricKeyField + '\'' +
                ", emitAllResults=" + emitAllResults +
                '}';
    }
}
