package com.driftsentinel.core.config;

import com.driftsentinel.core.exception.InvalidParametersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfigLoader}.
 */
class DetectorConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load detector settings from classpath")
    void shouldLoadFromClasspath() {
        DetectorConfig config = DetectorConfigLoader.fromClasspath("detector-test.yml");

        assertThat(config.getWindowSize()).isEqualTo(64);
        assertThat(config.getSentinelPercentile()).isEqualTo(95.0);
        assertThat(config.getConfirmPercentile()).isEqualTo(90.0);
        assertThat(config.getConsecutiveSentinels()).isEqualTo(2);
        assertThat(config.getEmbeddingDimension()).isEqualTo(3);
        assertThat(config.getKmax()).isEqualTo(6);
        assertThat(config.getProjections()).isEqualTo(25);
        assertThat(config.getQuantilePoints()).isEqualTo(32);
        assertThat(config.getDistancePower()).isEqualTo(1);
        assertThat(config.getRandomSeed()).hasValue(7L);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> DetectorConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should list every invalid field from the file")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> DetectorConfigLoader.fromClasspath("detector-invalid.yml"))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("windowSize")
                .hasMessageContaining("sentinelPercentile")
                .hasMessageContaining("kmax");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        assertThat(DetectorConfigLoader.fromClasspath("detector-empty.yml")).isEqualTo(DetectorConfig.defaults());
    }

    @Test
    @DisplayName("Should keep defaults for keys that are absent")
    void shouldMergeWithDefaults() {
        DetectorConfig config = parse("windowSize: 256\n");

        assertThat(config.getWindowSize()).isEqualTo(256);
        assertThat(config.getKmax()).isEqualTo(DetectorConfig.DEFAULT_KMAX);
        assertThat(config.getRandomSeed()).isEmpty();
    }

    @Test
    @DisplayName("Should reject unknown keys and duplicate keys")
    void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> parse("windowSize: 64\nwindowSise: 32\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed detector config");
        assertThatThrownBy(() -> parse("windowSize: 64\nwindowSize: 32\n"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("detector.yml");
        Files.writeString(file, "windowSize: 100\nconsecutiveSentinels: 4\nrandomSeed: 123\n");

        DetectorConfig config = DetectorConfigLoader.fromFile(file.toString());

        assertThat(config.getWindowSize()).isEqualTo(100);
        assertThat(config.getConsecutiveSentinels()).isEqualTo(4);
        assertThat(config.getRandomSeed()).hasValue(123L);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        String missing = tempDir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> DetectorConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectorConfig parse(String yaml) {
        return DetectorConfigLoader.parseAndValidate(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
    }
}
