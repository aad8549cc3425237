package com.fluxwatch.flink;

import com.fluxwatch.core.config.EngineConfig;
import com.fluxwatch.core.config.EngineConfigLoader;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Entry point of the FluxWatch live monitoring job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (observations topic)
 *     → JSON → MetricEvent
 *     → key by metric
 *     → StreamingDetectionFunction (one MetricMonitor per metric)
 *     → DetectionEvent → JSON
 *     → Kafka (detections topic)
 * </pre>
 *
 * <p>
 * Observations of one metric must arrive in timestamp order on one Kafka
 * partition; the detector consumes them in arrival order. Exactly-once
 * checkpointing keeps every metric's detector state across failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class FluxWatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(FluxWatchJob.class);

    private FluxWatchJob() {
        // entry-point class
    }

    public static void main(String[] args) throws Exception {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting FluxWatch with config: {}", config);

        HealthServer healthServer = new HealthServer();
        healthServer.start(config.getHealthPort());
        Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

        EngineConfig engineConfig = loadEngineConfig(config);
        LOG.info("Engine configuration: {}", engineConfig);

        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setParallelism(config.getParallelism());
        configureCheckpointing(env, config);

        buildPipeline(env, config, engineConfig);
        healthServer.markReady();

        env.execute("FluxWatch - Streaming POT Anomaly Detection");
    }

    /**
     * Build the Kafka → Flink → Kafka pipeline.
     */
    static void buildPipeline(StreamExecutionEnvironment env, JobConfig config, EngineConfig engineConfig) {
        KafkaSource<MetricEvent> source = KafkaSource.<MetricEvent>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setTopics(config.getKafkaInputTopic())
                .setGroupId(config.getKafkaGroupId())
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setValueOnlyDeserializer(new MetricEventDeserializationSchema(config.getMetricKeyField()))
                .build();

        DataStream<MetricEvent> events = env.fromSource(source, WatermarkStrategy.noWatermarks(),
                "kafka-observations-source");

        DataStream<DetectionEvent> detections = events
                .filter(Objects::nonNull)
                .name("drop-malformed")
                .keyBy(MetricEvent::getMetric)
                .process(new StreamingDetectionFunction(engineConfig, config.isEmitAllResults()))
                .name("pot-detection");

        KafkaSink<DetectionEvent> sink = KafkaSink.<DetectionEvent>builder()
                .setBootstrapServers(config.getKafkaBootstrapServers())
                .setRecordSerializer(
                        KafkaRecordSerializationSchema.builder()
                                .setTopic(config.getKafkaOutputTopic())
                                .setKeySerializationSchema(DetectionEventSerializationSchema.keySchema())
                                .setValueSerializationSchema(new DetectionEventSerializationSchema())
                                .build())
                .build();

        detections.sinkTo(sink).name("kafka-detections-sink");
    }

    static EngineConfig loadEngineConfig(JobConfig config) {
        String path = config.getEngineConfigPath();
        if (path != null && !path.isBlank()) {
            return EngineConfigLoader.fromFile(path);
        }
        return EngineConfigLoader.load();
    }

    private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
        long interval = config.getCheckpointIntervalMs();
        env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

        CheckpointConfig cpConfig = env.getCheckpointConfig();
        cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
        cpConfig.setCheckpointTimeout(interval * 2);
        cpConfig.setMaxConcurrentCheckpoints(1);
        cpConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
    }
}
