package com.driftsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig} resolution and validation.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults produce a valid config")
    void defaultsAreValid() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaInputTopic()).isEqualTo("telemetry-windows");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("drift-alerts");
        assertThat(config.getKafkaGroupId()).isEqualTo("drift-sentinel");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getBaselinePath()).isEmpty();
        assertThat(config.isEmitAllResults()).isFalse();
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should keep explicitly set values")
    void shouldKeepExplicitValues() {
        JobConfig config = new JobConfig.Builder()
                .baselinePath("/data/baseline.json")
                .detectorConfigPath("/etc/detector.yml")
                .emitAllResults(true)
                .parallelism(4)
                .build();

        assertThat(config.getBaselinePath()).isEqualTo("/data/baseline.json");
        assertThat(config.getDetectorConfigPath()).isEqualTo("/etc/detector.yml");
        assertThat(config.isEmitAllResults()).isTrue();
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.toString()).contains("emitAllResults=true");
    }

    @Test
    @DisplayName("Should reject blank topics")
    void shouldRejectBlankTopic() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaInputTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaInputTopic");
    }

    @Test
    @DisplayName("Should reject out-of-range numbers")
    void shouldRejectOutOfRangeNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should report every invalid field in one message")
    void shouldReportAllErrors() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).kafkaGroupId("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism")
                .hasMessageContaining("kafkaGroupId");
    }

    @Test
    @DisplayName("Should reject an alert topic equal to the input topic")
    void shouldRejectLoopingTopics() {
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaAlertTopic("telemetry-windows").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaAlertTopic");
    }

    @Test
    @DisplayName("Should resolve variables and ignore blank ones")
    void shouldResolveFromEnvironment() {
        Map<String, String> env = Map.of(
                "KAFKA_INPUT_TOPIC", "plant-a",
                "FLINK_PARALLELISM", " 3 ",
                "EMIT_ALL_RESULTS", "yes",
                "BASELINE_PATH", "/data/baseline.json",
                "KAFKA_GROUP_ID", "  ");

        JobConfig config = JobConfig.fromEnvironment(env::get);

        assertThat(config.getKafkaInputTopic()).isEqualTo("plant-a");
        assertThat(config.getParallelism()).isEqualTo(3);
        assertThat(config.isEmitAllResults()).isTrue();
        assertThat(config.getKafkaGroupId()).isEqualTo("drift-sentinel");
        assertThat(config.requireBaselinePath()).isEqualTo("/data/baseline.json");
    }

    @Test
    @DisplayName("Should name the variable that fails to parse")
    void shouldNameUnparsableVariable() {
        Map<String, String> env = Map.of("HEALTH_PORT", "eighty");

        assertThatThrownBy(() -> JobConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HEALTH_PORT");
    }

    @Test
    @DisplayName("Missing baseline path fails when required")
    void missingBaselineFails() {
        JobConfig config = JobConfig.fromEnvironment(name -> null);

        assertThatThrownBy(config::requireBaselinePath)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BASELINE_PATH");
    }

    @Test
    @DisplayName("Should parse common boolean spellings")
    void shouldParseBooleans() {
        assertThat(JobConfig.parseBoolean("EMIT_ALL_RESULTS", "TRUE")).isTrue();
        assertThat(JobConfig.parseBoolean("EMIT_ALL_RESULTS", "1")).isTrue();
        assertThat(JobConfig.parseBoolean("EMIT_ALL_RESULTS", " no ")).isFalse();
        assertThatThrownBy(() -> JobConfig.parseBoolean("EMIT_ALL_RESULTS", "maybe"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("EMIT_ALL_RESULTS");
    }
}
