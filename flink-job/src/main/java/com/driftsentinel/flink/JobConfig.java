package com.driftsentinel.flink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Deployment settings of the Drift Sentinel Flink job: where telemetry comes
 * from, where alerts go, and where the baseline and detector settings live.
 *
 * <p>
 * {@link #fromEnvironment()} reads the process environment. Detector
 * parameters themselves are a separate YAML document, see
 * {@link com.driftsentinel.core.config.DetectorConfigLoader}.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@code KAFKA_BOOTSTRAP_SERVERS}</td><td>{@code localhost:9092}</td></tr>
 * <tr><td>{@code KAFKA_INPUT_TOPIC}</td><td>{@code telemetry-windows}</td></tr>
 * <tr><td>{@code KAFKA_ALERT_TOPIC}</td><td>{@code drift-alerts}</td></tr>
 * <tr><td>{@code KAFKA_GROUP_ID}</td><td>{@code drift-sentinel}</td></tr>
 * <tr><td>{@code FLINK_PARALLELISM}</td><td>{@code 1}</td></tr>
 * <tr><td>{@code FLINK_CHECKPOINT_INTERVAL_MS}</td><td>{@code 60000}</td></tr>
 * <tr><td>{@code DETECTOR_CONFIG_PATH}</td><td>classpath {@code detector.yml}</td></tr>
 * <tr><td>{@code BASELINE_PATH}</td><td>required by the job</td></tr>
 * <tr><td>{@code EMIT_ALL_RESULTS}</td><td>{@code false}</td></tr>
 * <tr><td>{@code HEALTH_PORT}</td><td>{@code 8080}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String bootstrapServers;
    private final String telemetryTopic;
    private final String alertTopic;
    private final String consumerGroup;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String detectorConfigPath;
    private final String baselinePath;
    private final boolean emitAllResults;
    private final int healthPort;

    private JobConfig(Builder b) {
        this.bootstrapServers = b.bootstrapServers;
        this.telemetryTopic = b.telemetryTopic;
        this.alertTopic = b.alertTopic;
        this.consumerGroup = b.consumerGroup;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.detectorConfigPath = b.detectorConfigPath;
        this.baselinePath = b.baselinePath;
        this.emitAllResults = b.emitAllResults;
        this.healthPort = b.healthPort;
    }

    /**
     * Resolve the job settings from the process environment.
     *
     * @throws IllegalStateException    if a variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Resolve the job settings from a variable lookup; blank values count as
     * unset.
     */
    static JobConfig fromEnvironment(Function<String, String> lookup) {
        EnvReader env = new EnvReader(lookup);
        Builder builder = new Builder();
        env.ifSet("KAFKA_BOOTSTRAP_SERVERS", builder::kafkaBootstrapServers);
        env.ifSet("KAFKA_INPUT_TOPIC", builder::kafkaInputTopic);
        env.ifSet("KAFKA_ALERT_TOPIC", builder::kafkaAlertTopic);
        env.ifSet("KAFKA_GROUP_ID", builder::kafkaGroupId);
        env.ifSet("DETECTOR_CONFIG_PATH", builder::detectorConfigPath);
        env.ifSet("BASELINE_PATH", builder::baselinePath);
        env.ifSet("FLINK_PARALLELISM", v -> builder.parallelism(env.parseInt("FLINK_PARALLELISM", v)));
        env.ifSet("FLINK_CHECKPOINT_INTERVAL_MS",
                v -> builder.checkpointIntervalMs(env.parseLong("FLINK_CHECKPOINT_INTERVAL_MS", v)));
        env.ifSet("EMIT_ALL_RESULTS", v -> builder.emitAllResults(parseBoolean("EMIT_ALL_RESULTS", v)));
        env.ifSet("HEALTH_PORT", v -> builder.healthPort(env.parseInt("HEALTH_PORT", v)));
        return builder.build();
    }

    public String getKafkaBootstrapServers() {
        return bootstrapServers;
    }

    public String getKafkaInputTopic() {
        return telemetryTopic;
    }

    public String getKafkaAlertTopic() {
        return alertTopic;
    }

    public String getKafkaGroupId() {
        return consumerGroup;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** Empty when the bundled {@code detector.yml} applies. */
    public String getDetectorConfigPath() {
        return detectorConfigPath;
    }

    public String getBaselinePath() {
        return baselinePath;
    }

    /**
     * The baseline document the job calibrates against.
     *
     * @throws IllegalStateException if {@code BASELINE_PATH} was not given
     */
    public String requireBaselinePath() {
        if (baselinePath.isBlank()) {
            throw new IllegalStateException(
                    "No baseline defined. Provide a baseline JSON document via BASELINE_PATH.");
        }
        return baselinePath;
    }

    /**
     * @return {@code true} to publish a record for every evaluated window,
     *         not only for confirmed drift
     */
    public boolean isEmitAllResults() {
        return emitAllResults;
    }

    public int getHealthPort() {
        return healthPort;
    }

    /**
     * Accepts {@code true/1/yes} and {@code false/0/no}, case-insensitively.
     *
     * @throws IllegalStateException for any other value
     */
    static boolean parseBoolean(String name, String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalStateException(
                        "Environment variable " + name + " must be a boolean, got: " + value);
        }
    }

    /**
     * Fluent builder; {@link #build()} reports every invalid field at once.
     */
    public static class Builder {
        private String bootstrapServers = "localhost:9092";
        private String telemetryTopic = "telemetry-windows";
        private String alertTopic = "drift-alerts";
        private String consumerGroup = "drift-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String detectorConfigPath = "";
        private String baselinePath = "";
        private boolean emitAllResults = false;
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.bootstrapServers = v;
            return this;
        }

        public Builder kafkaInputTopic(String v) {
            this.telemetryTopic = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.alertTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.consumerGroup = v;
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

        public Builder detectorConfigPath(String v) {
            this.detectorConfigPath = v == null ? "" : v;
            return this;
        }

        public Builder baselinePath(String v) {
            this.baselinePath = v == null ? "" : v;
            return this;
        }

        public Builder emitAllResults(boolean v) {
            this.emitAllResults = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException listing every invalid field
         */
        public JobConfig build() {
            List<String> errors = new ArrayList<>();
            requireNonBlank(errors, "kafkaBootstrapServers", bootstrapServers);
            requireNonBlank(errors, "kafkaInputTopic", telemetryTopic);
            requireNonBlank(errors, "kafkaAlertTopic", alertTopic);
            requireNonBlank(errors, "kafkaGroupId", consumerGroup);
            if (telemetryTopic != null && telemetryTopic.equals(alertTopic)) {
                errors.add("kafkaAlertTopic must differ from kafkaInputTopic, both are: " + alertTopic);
            }
            if (parallelism < 1) {
                errors.add("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                errors.add("checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                errors.add("healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException("Invalid JobConfig: " + String.join("; ", errors));
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(List<String> errors, String name, String value) {
            if (value == null || value.isBlank()) {
                errors.add(name + " must not be blank");
            }
        }
    }

    /** Reads variables through a lookup and names the variable in parse errors. */
    private static final class EnvReader {
        private final Function<String, String> lookup;

        EnvReader(Function<String, String> lookup) {
            this.lookup = lookup;
        }

        void ifSet(String name, Consumer<String> target) {
            String value = lookup.apply(name);
            if (value != null && !value.isBlank()) {
                target.accept(value.trim());
            }
        }

        int parseInt(String name, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                        "Environment variable " + name + " must be an integer, got: " + value, e);
            }
        }

        long parseLong(String name, String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException(
                        "Environment variable " + name + " must be an integer, got: " + value, e);
            }
        }
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafka=" + bootstrapServers +
                ", topics=" + telemetryTopic + "->" + alertTopic +
                ", group=" + consumerGroup +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", detectorConfigPath='" + detectorConfigPath + '\'' +
                ", baselinePath='" + baselinePath + '\'' +
                ", emitAllResults=" + emitAllResults +
                ", healthPort=" + healthPort +
                '}';
    }
}
