package com.driftsentinel.flink;

import com.driftsentinel.core.model.DetectionResult;
import com.driftsentinel.core.model.DetectorState;
import com.driftsentinel.core.model.DriftAlert;
import com.driftsentinel.core.model.Thresholds;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DriftAlertSerializationSchema}.
 */
class DriftAlertSerializationSchemaTest {

    private final DriftAlertSerializationSchema schema = new DriftAlertSerializationSchema();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should serialize a confirmed alert with ISO timestamp and thresholds")
    void shouldSerializeConfirmedAlert() throws IOException {
        DetectionResult result = DetectionResult.builder()
                .permutationEntropy(0.91)
                .fractalDimension(-0.1)
                .fractalTriggered(true)
                .confirm(4.2, true)
                .hysteresisCount(3)
                .state(DetectorState.CONFIRMED)
                .thresholds(new Thresholds(0.99, -0.7, 0.3))
                .build();

        JsonNode json = mapper.readTree(schema.serialize(
                DriftAlert.of("pump-7", Instant.parse("2024-03-01T12:00:00Z"), result)));

        assertThat(json.get("streamKey").asText()).isEqualTo("pump-7");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00Z");
        assertThat(json.get("details").asText()).startsWith("Drift confirmed");
        JsonNode body = json.get("result");
        assertThat(body.get("alert").asBoolean()).isTrue();
        assertThat(body.get("slicedDistance").asDouble()).isEqualTo(4.2);
        assertThat(body.get("state").asText()).isEqualTo("CONFIRMED");
        assertThat(body.get("thresholds").get(Thresholds.SLICED_DISTANCE).asDouble()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Skipped confirm layer serializes as an explicit null distance")
    void shouldWriteNullDistance() throws IOException {
        DetectionResult result = DetectionResult.builder()
                .state(DetectorState.IDLE)
                .thresholds(new Thresholds(0.99, -0.7, 0.3))
                .build();

        JsonNode json = mapper.readTree(schema.serialize(DriftAlert.of("s", Instant.EPOCH, result)));

        assertThat(json.get("result").has("slicedDistance")).isTrue();
        assertThat(json.get("result").get("slicedDistance").isNull()).isTrue();
        assertThat(json.get("result").get("alert").asBoolean()).isFalse();
    }
}
