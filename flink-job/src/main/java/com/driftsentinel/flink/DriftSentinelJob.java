package com.driftsentinel.flink;

import com.driftsentinel.core.config.DetectorConfig;
import com.driftsentinel.core.config.DetectorConfigLoader;
import com.driftsentinel.core.detection.BaselineCalibrator;
import com.driftsentinel.core.detection.Calibration;
import com.driftsentinel.core.detection.LayeredDriftDetector;
import com.driftsentinel.core.model.DriftAlert;
import com.driftsentinel.core.model.TelemetryWindow;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.Types;
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
 * Main entry point for the Drift Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry windows topic)
 *     → Deserialize JSON → TelemetryWindow
 *     → Key by stream id
 *     → DriftProcessFunction (one layered detector per stream)
 *     → Serialize DriftAlert → JSON
 *     → Kafka (alerts topic)
 * </pre>
 *
 * <h3>Startup</h3>
 * <p>
 * The baseline named by {@code BASELINE_PATH} is calibrated once, before the
 * pipeline is built, and the resulting {@link Calibration} is shipped to
 * every task. {@code /readiness} reports ready only after calibration
 * succeeds.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once checkpointing keeps each stream's hysteresis counter across
 * failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class DriftSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(DriftSentinelJob.class);

        static final String UNKNOWN_STREAM = "__unknown__";

        private DriftSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Drift Sentinel with config: {}", config);
                DetectorConfig detectorConfig = loadDetectorConfig(config);

                String baselinePath = config.requireBaselinePath();

                // 2. Start health server (for K8s probes) with shutdown hook
                HealthServer healthServer = new HealthServer();
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 3. Calibrate once against the baseline
                BaselineData baseline = BaselineLoader.fromFile(baselinePath);
                Calibration calibration = BaselineCalibrator.calibrate(detectorConfig, baseline.toSeries(),
                                baseline.toReference(), LayeredDriftDetector.resolveSeed(detectorConfig));
                healthServer.markReady();

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, detectorConfig, calibration);

                // 6. Execute
                env.execute("Drift Sentinel: Layered Drift Detection");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        DetectorConfig detectorConfig,
                        Calibration calibration) {
                KafkaSource<TelemetryWindow> kafkaSource = KafkaSource.<TelemetryWindow>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaInputTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new TelemetryWindowDeserializationSchema())
                                .build();

                DataStream<TelemetryWindow> windows = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<TelemetryWindow>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-telemetry-source");

                DataStream<DriftAlert> alerts = windows
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(DriftSentinelJob::streamKey, Types.STRING)
                                .process(new DriftProcessFunction(detectorConfig, calibration,
                                                config.isEmitAllResults()))
                                .name("drift-detection");

                KafkaSink<DriftAlert> kafkaSink = KafkaSink.<DriftAlert>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaAlertTopic())
                                                                .setValueSerializationSchema(
                                                                                new DriftAlertSerializationSchema())
                                                                .build())
                                .build();

                alerts.sinkTo(kafkaSink).name("kafka-alerts-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static String streamKey(TelemetryWindow window) {
                String stream = window.getStream();
                return stream != null && !stream.isBlank() ? stream : UNKNOWN_STREAM;
        }

        private static DetectorConfig loadDetectorConfig(JobConfig config) {
                String path = config.getDetectorConfigPath();
                if (path != null && !path.isBlank()) {
                        return DetectorConfigLoader.fromFile(path);
                }
                return DetectorConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
