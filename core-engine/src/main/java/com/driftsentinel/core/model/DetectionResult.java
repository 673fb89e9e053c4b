package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outcome of evaluating one telemetry window.
 *
 * <p>
 * A fresh instance is produced for every call to
 * {@link com.driftsentinel.core.detection.DriftDetector#check}; it is
 * immutable after construction. The sliced distance is only present when the
 * confirm layer ran for this window.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code thresholds} and {@code state} are
 * required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "permutationEntropy", "fractalDimension", "entropyTriggered", "fractalTriggered",
        "sentinelTriggered", "confirmEvaluated", "slicedDistance", "confirmTriggered", "alert",
        "hysteresisCount", "state", "thresholds" })
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double permutationEntropy;
    private final double fractalDimension;
    private final boolean entropyTriggered;
    private final boolean fractalTriggered;
    private final boolean confirmEvaluated;
    private final Double slicedDistance;
    private final boolean confirmTriggered;
    private final int hysteresisCount;
    private final DetectorState state;
    private final Thresholds thresholds;

    private DetectionResult(Builder builder) {
        this.permutationEntropy = builder.permutationEntropy;
        this.fractalDimension = builder.fractalDimension;
        this.entropyTriggered = builder.entropyTriggered;
        this.fractalTriggered = builder.fractalTriggered;
        this.slicedDistance = builder.slicedDistance;
        this.confirmEvaluated = builder.slicedDistance != null;
        this.confirmTriggered = confirmEvaluated && builder.confirmTriggered;
        this.hysteresisCount = builder.hysteresisCount;
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectionResult}.
     */
    public static class Builder {
        private double permutationEntropy;
        private double fractalDimension;
        private boolean entropyTriggered;
        private boolean fractalTriggered;
        private Double slicedDistance;
        private boolean confirmTriggered;
        private int hysteresisCount;
        private DetectorState state;
        private Thresholds thresholds;

        public Builder permutationEntropy(double value) {
            this.permutationEntropy = value;
            return this;
        }

        public Builder fractalDimension(double value) {
            this.fractalDimension = value;
            return this;
        }

        public Builder entropyTriggered(boolean value) {
            this.entropyTriggered = value;
            return this;
        }

        public Builder fractalTriggered(boolean value) {
            this.fractalTriggered = value;
            return this;
        }

        /**
         * Record the confirm layer outcome. Leaving this unset means the
         * confirm layer did not run.
         */
        public Builder confirm(double distance, boolean triggered) {
            this.slicedDistance = distance;
            this.confirmTriggered = triggered;
            return this;
        }

        public Builder hysteresisCount(int value) {
            this.hysteresisCount = value;
            return this;
        }

        public Builder state(DetectorState value) {
            this.state = value;
            return this;
        }

        public Builder thresholds(Thresholds value) {
            this.thresholds = value;
            return this;
        }

        /**
         * @throws NullPointerException if {@code state} or {@code thresholds} is
         *                              missing
         */
        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    public double getPermutationEntropy() {
        return permutationEntropy;
    }

    public double getFractalDimension() {
        return fractalDimension;
    }

    public boolean isEntropyTriggered() {
        return entropyTriggered;
    }

    public boolean isFractalTriggered() {
        return fractalTriggered;
    }

    /**
     * @return {@code true} if either sentinel metric crossed its threshold
     */
    public boolean isSentinelTriggered() {
        return entropyTriggered || fractalTriggered;
    }

    public boolean isConfirmEvaluated() {
        return confirmEvaluated;
    }

    /**
     * @return sliced distance, or {@code null} if the confirm layer did not run
     */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Double getSlicedDistance() {
        return slicedDistance;
    }

    /**
     * @return sliced distance, empty if the confirm layer did not run
     */
    public OptionalDouble distance() {
        return slicedDistance == null ? OptionalDouble.empty() : OptionalDouble.of(slicedDistance);
    }

    public boolean isConfirmTriggered() {
        return confirmTriggered;
    }

    /**
     * @return {@code true} when both layers agree that the window drifted
     */
    public boolean isAlert() {
        return isSentinelTriggered() && confirmTriggered;
    }

    public int getHysteresisCount() {
        return hysteresisCount;
    }

    public DetectorState getState() {
        return state;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    /**
     * Metric values keyed like {@link Thresholds#asMap()}. The sliced distance
     * is {@link Double#NaN} when the confirm layer did not run.
     *
     * @return unmodifiable metric map
     */
    @JsonIgnore
    public Map<String, Double> metrics() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(Thresholds.PERMUTATION_ENTROPY, permutationEntropy);
        map.put(Thresholds.FRACTAL_DIMENSION, fractalDimension);
        map.put(Thresholds.SLICED_DISTANCE, slicedDistance != null ? slicedDistance : Double.NaN);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "pe=" + permutationEntropy +
                ", hfd=" + fractalDimension +
                ", sentinel=" + isSentinelTriggered() +
                ", distance=" + slicedDistance +
                ", alert=" + isAlert() +
                ", state=" + state +
                '}';
    }
}
