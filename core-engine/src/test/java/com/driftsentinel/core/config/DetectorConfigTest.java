package com.driftsentinel.core.config;

import com.driftsentinel.core.exception.InvalidParametersException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfig} validation.
 */
class DetectorConfigTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaultsAreDocumented() {
        DetectorConfig config = DetectorConfig.defaults();

        assertThat(config.getWindowSize()).isEqualTo(512);
        assertThat(config.getSentinelPercentile()).isEqualTo(95.0);
        assertThat(config.getConfirmPercentile()).isEqualTo(95.0);
        assertThat(config.getConsecutiveSentinels()).isEqualTo(3);
        assertThat(config.getEmbeddingDimension()).isEqualTo(4);
        assertThat(config.getDelay()).isEqualTo(1);
        assertThat(config.getKmax()).isEqualTo(8);
        assertThat(config.getProjections()).isEqualTo(100);
        assertThat(config.getQuantilePoints()).isEqualTo(128);
        assertThat(config.getDistancePower()).isEqualTo(2);
        assertThat(config.getRandomSeed()).isEmpty();
    }

    @Test
    @DisplayName("Should accept a percentile of exactly 100")
    void shouldAcceptUpperPercentileBound() {
        DetectorConfig config = DetectorConfig.builder().sentinelPercentile(100).confirmPercentile(100).build();

        assertThat(config.getSentinelPercentile()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should reject a percentile of 0")
    void shouldRejectZeroPercentile() {
        assertThatThrownBy(() -> DetectorConfig.builder().confirmPercentile(0).build())
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("confirmPercentile");
    }

    @Test
    @DisplayName("Should report every invalid field at once")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> DetectorConfig.builder()
                .windowSize(0)
                .consecutiveSentinels(0)
                .embeddingDimension(1)
                .kmax(1)
                .distancePower(0)
                .build())
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("windowSize")
                .hasMessageContaining("consecutiveSentinels")
                .hasMessageContaining("embeddingDimension")
                .hasMessageContaining("kmax")
                .hasMessageContaining("distancePower");
    }

    @Test
    @DisplayName("Should reject a window shorter than one ordinal pattern")
    void shouldRejectWindowShorterThanPattern() {
        assertThatThrownBy(() -> DetectorConfig.builder().windowSize(6).embeddingDimension(4).delay(2).build())
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("windowSize must be >= 7");
    }

    @Test
    @DisplayName("Should cap the embedding dimension")
    void shouldCapEmbeddingDimension() {
        assertThatThrownBy(() -> DetectorConfig.builder().embeddingDimension(16).build())
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("embeddingDimension");
    }

    @Test
    @DisplayName("toBuilder round-trips every field")
    void toBuilderRoundTrips() {
        DetectorConfig config = DetectorConfig.builder()
                .windowSize(128)
                .sentinelPercentile(99)
                .confirmPercentile(90)
                .consecutiveSentinels(5)
                .embeddingDimension(5)
                .delay(2)
                .kmax(10)
                .projections(20)
                .quantilePoints(64)
                .distancePower(1)
                .randomSeed(3L)
                .build();

        assertThat(config.toBuilder().build()).isEqualTo(config);
        assertThat(config.toBuilder().randomSeed(4L).build()).isNotEqualTo(config);
        assertThat(config.getRandomSeed()).hasValue(3L);
    }
}
