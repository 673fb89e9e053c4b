package com.driftsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionResult}, {@link DetectorState} and
 * {@link DriftAlert}.
 */
class DetectionResultTest {

    private static final Thresholds THRESHOLDS = new Thresholds(0.9, -0.6, 0.3);

    @Test
    @DisplayName("Sentinel-only result has no distance and no alert")
    void sentinelOnlyResult() {
        DetectionResult result = base().fractalTriggered(true).hysteresisCount(1)
                .state(DetectorState.SUSPECT).build();

        assertThat(result.isSentinelTriggered()).isTrue();
        assertThat(result.isConfirmEvaluated()).isFalse();
        assertThat(result.getSlicedDistance()).isNull();
        assertThat(result.distance()).isEmpty();
        assertThat(result.isAlert()).isFalse();
        assertThat(result.metrics().get(Thresholds.SLICED_DISTANCE)).isNaN();
    }

    @Test
    @DisplayName("Alert requires both layers")
    void alertRequiresBothLayers() {
        DetectionResult alert = base().entropyTriggered(true).confirm(0.8, true).hysteresisCount(3).build();
        DetectionResult belowConfirm = base().entropyTriggered(true).confirm(0.1, false).hysteresisCount(3).build();

        assertThat(alert.isAlert()).isTrue();
        assertThat(alert.distance()).hasValue(0.8);
        assertThat(alert.metrics()).containsKeys(Thresholds.PERMUTATION_ENTROPY, Thresholds.FRACTAL_DIMENSION)
                .containsEntry(Thresholds.SLICED_DISTANCE, 0.8);
        assertThat(belowConfirm.isAlert()).isFalse();
    }

    @Test
    @DisplayName("Should require state and thresholds")
    void shouldRequireStateAndThresholds() {
        assertThatThrownBy(() -> DetectionResult.builder().thresholds(THRESHOLDS).build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> DetectionResult.builder().state(DetectorState.IDLE).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("State follows the hysteresis count")
    void stateFollowsCount() {
        assertThat(DetectorState.of(0, 3)).isEqualTo(DetectorState.IDLE);
        assertThat(DetectorState.of(2, 3)).isEqualTo(DetectorState.SUSPECT);
        assertThat(DetectorState.of(3, 3)).isEqualTo(DetectorState.CONFIRMED);
        assertThat(DetectorState.of(1, 1)).isEqualTo(DetectorState.CONFIRMED);
    }

    @Test
    @DisplayName("Alert details summarize the result")
    void alertDetailsSummarizeResult() {
        DetectionResult result = base().entropyTriggered(true).confirm(0.8, true).hysteresisCount(3).build();

        DriftAlert alert = DriftAlert.of("pump-7", Instant.EPOCH, result);

        assertThat(alert.getStreamKey()).isEqualTo("pump-7");
        assertThat(alert.getDetails())
                .startsWith("Drift confirmed")
                .contains("distance=0.8000 (threshold 0.3000)")
                .contains("state=CONFIRMED");
    }

    @Test
    @DisplayName("Summary marks a skipped confirm layer")
    void summaryMarksSkippedConfirm() {
        DetectionResult result = base().state(DetectorState.IDLE).build();

        assertThat(DriftAlert.summarize(result)).startsWith("No drift").contains("distance=not evaluated");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectionResult.Builder base() {
        return DetectionResult.builder()
                .permutationEntropy(0.95)
                .fractalDimension(-0.2)
                .state(DetectorState.CONFIRMED)
                .thresholds(THRESHOLDS);
    }
}
