package com.driftsentinel.core.config;

import com.driftsentinel.core.estimator.OrdinalEntropyEstimator;
import com.driftsentinel.core.exception.InvalidParametersException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Typed, immutable configuration of a layered drift detector.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder()} for programmatic and test scenarios, or
 * {@link DetectorConfigLoader} to read a YAML file. The builder validates
 * every field at {@link Builder#build()} time and reports all problems at
 * once.
 * </p>
 *
 * <h3>Defaults</h3>
 * <table>
 * <caption>Default values</caption>
 * <tr><td>windowSize</td><td>512</td></tr>
 * <tr><td>sentinelPercentile / confirmPercentile</td><td>95</td></tr>
 * <tr><td>consecutiveSentinels</td><td>3</td></tr>
 * <tr><td>embeddingDimension / delay</td><td>4 / 1</td></tr>
 * <tr><td>kmax</td><td>8</td></tr>
 * <tr><td>projections / quantilePoints</td><td>100 / 128</td></tr>
 * <tr><td>distancePower</td><td>2</td></tr>
 * <tr><td>randomSeed</td><td>none (drawn once per detector)</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WINDOW_SIZE = 512;
    public static final double DEFAULT_PERCENTILE = 95.0;
    public static final int DEFAULT_CONSECUTIVE_SENTINELS = 3;
    public static final int DEFAULT_EMBEDDING_DIMENSION = 4;
    public static final int DEFAULT_DELAY = 1;
    public static final int DEFAULT_KMAX = 8;
    public static final int DEFAULT_PROJECTIONS = 100;
    public static final int DEFAULT_QUANTILE_POINTS = 128;
    public static final int DEFAULT_DISTANCE_POWER = 2;

    // ---------------------------------------------------------------
    // Windowing and calibration
    // ---------------------------------------------------------------
    private final int windowSize;
    private final double sentinelPercentile;
    private final double confirmPercentile;
    private final int consecutiveSentinels;

    // ---------------------------------------------------------------
    // Sentinel estimators
    // ---------------------------------------------------------------
    private final int embeddingDimension;
    private final int delay;
    private final int kmax;

    // ---------------------------------------------------------------
    // Confirm estimator
    // ---------------------------------------------------------------
    private final int projections;
    private final int quantilePoints;
    private final int distancePower;
    private final Long randomSeed;

    private DetectorConfig(Builder b) {
        this.windowSize = b.windowSize;
        this.sentinelPercentile = b.sentinelPercentile;
        this.confirmPercentile = b.confirmPercentile;
        this.consecutiveSentinels = b.consecutiveSentinels;
        this.embeddingDimension = b.embeddingDimension;
        this.delay = b.delay;
        this.kmax = b.kmax;
        this.projections = b.projections;
        this.quantilePoints = b.quantilePoints;
        this.distancePower = b.distancePower;
        this.randomSeed = b.randomSeed;
    }

    /**
     * @return a configuration with every default applied
     */
    public static DetectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        return new Builder()
                .windowSize(windowSize)
                .sentinelPercentile(sentinelPercentile)
                .confirmPercentile(confirmPercentile)
                .consecutiveSentinels(consecutiveSentinels)
                .embeddingDimension(embeddingDimension)
                .delay(delay)
                .kmax(kmax)
                .projections(projections)
                .quantilePoints(quantilePoints)
                .distancePower(distancePower)
                .randomSeed(randomSeed);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public double getSentinelPercentile() {
        return sentinelPercentile;
    }

    public double getConfirmPercentile() {
        return confirmPercentile;
    }

    public int getConsecutiveSentinels() {
        return consecutiveSentinels;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public int getDelay() {
        return delay;
    }

    public int getKmax() {
        return kmax;
    }

    public int getProjections() {
        return projections;
    }

    public int getQuantilePoints() {
        return quantilePoints;
    }

    public int getDistancePower() {
        return distancePower;
    }

    public OptionalLong getRandomSeed() {
        return randomSeed == null ? OptionalLong.empty() : OptionalLong.of(randomSeed);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectorConfig}.
     */
    public static class Builder {
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private double sentinelPercentile = DEFAULT_PERCENTILE;
        private double confirmPercentile = DEFAULT_PERCENTILE;
        private int consecutiveSentinels = DEFAULT_CONSECUTIVE_SENTINELS;
        private int embeddingDimension = DEFAULT_EMBEDDING_DIMENSION;
        private int delay = DEFAULT_DELAY;
        private int kmax = DEFAULT_KMAX;
        private int projections = DEFAULT_PROJECTIONS;
        private int quantilePoints = DEFAULT_QUANTILE_POINTS;
        private int distancePower = DEFAULT_DISTANCE_POWER;
        private Long randomSeed;

        public Builder windowSize(int v) {
            this.windowSize = v;
            return this;
        }

        public Builder sentinelPercentile(double v) {
            this.sentinelPercentile = v;
            return this;
        }

        public Builder confirmPercentile(double v) {
            this.confirmPercentile = v;
            return this;
        }

        public Builder consecutiveSentinels(int v) {
            this.consecutiveSentinels = v;
            return this;
        }

        public Builder embeddingDimension(int v) {
            this.embeddingDimension = v;
            return this;
        }

        public Builder delay(int v) {
            this.delay = v;
            return this;
        }

        public Builder kmax(int v) {
            this.kmax = v;
            return this;
        }

        public Builder projections(int v) {
            this.projections = v;
            return this;
        }

        public Builder quantilePoints(int v) {
            this.quantilePoints = v;
            return this;
        }

        public Builder distancePower(int v) {
            this.distancePower = v;
            return this;
        }

        /**
         * @param v seed for the projection directions, or {@code null} to draw
         *          one per detector
         */
        public Builder randomSeed(Long v) {
            this.randomSeed = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectorConfig}
         * @throws InvalidParametersException listing every invalid field
         */
        public DetectorConfig build() {
            List<String> errors = new ArrayList<>();

            if (windowSize < 1) {
                errors.add("windowSize must be >= 1, got: " + windowSize);
            }
            requirePercentile(errors, "sentinelPercentile", sentinelPercentile);
            requirePercentile(errors, "confirmPercentile", confirmPercentile);
            if (consecutiveSentinels < 1) {
                errors.add("consecutiveSentinels must be >= 1, got: " + consecutiveSentinels);
            }
            if (embeddingDimension < 2 || embeddingDimension > OrdinalEntropyEstimator.MAX_EMBEDDING_DIMENSION) {
                errors.add("embeddingDimension must be in [2, " + OrdinalEntropyEstimator.MAX_EMBEDDING_DIMENSION
                        + "], got: " + embeddingDimension);
            }
            if (delay < 1) {
                errors.add("delay must be >= 1, got: " + delay);
            }
            if (kmax < 2) {
                errors.add("kmax must be >= 2, got: " + kmax);
            }
            if (projections < 1) {
                errors.add("projections must be >= 1, got: " + projections);
            }
            if (quantilePoints < 1) {
                errors.add("quantilePoints must be >= 1, got: " + quantilePoints);
            }
            if (distancePower < 1) {
                errors.add("distancePower must be >= 1, got: " + distancePower);
            }

            long minimumWindow = Math.max(2L, (long) (embeddingDimension - 1) * delay + 1);
            if (errors.isEmpty() && windowSize < minimumWindow) {
                errors.add("windowSize must be >= " + minimumWindow
                        + " for embeddingDimension=" + embeddingDimension + " and delay=" + delay
                        + ", got: " + windowSize);
            }

            if (!errors.isEmpty()) {
                throw new InvalidParametersException(
                        "Invalid DetectorConfig: " + String.join("; ", errors));
            }
            return new DetectorConfig(this);
        }

        private static void requirePercentile(List<String> errors, String name, double value) {
            if (!(value > 0.0 && value <= 100.0)) {
                errors.add(name + " must be in (0, 100], got: " + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return windowSize == that.windowSize
                && Double.compare(sentinelPercentile, that.sentinelPercentile) == 0
                && Double.compare(confirmPercentile, that.confirmPercentile) == 0
                && consecutiveSentinels == that.consecutiveSentinels
                && embeddingDimension == that.embeddingDimension
                && delay == that.delay
                && kmax == that.kmax
                && projections == that.projections
                && quantilePoints == that.quantilePoints
                && distancePower == that.distancePower
                && Objects.equals(randomSeed, that.randomSeed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(windowSize, sentinelPercentile, confirmPercentile, consecutiveSentinels,
                embeddingDimension, delay, kmax, projections, quantilePoints, distancePower, randomSeed);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "windowSize=" + windowSize +
                ", sentinelPercentile=" + sentinelPercentile +
                ", confirmPercentile=" + confirmPercentile +
                ", consecutiveSentinels=" + consecutiveSentinels +
                ", embeddingDimension=" + embeddingDimension +
                ", delay=" + delay +
                ", kmax=" + kmax +
                ", projections=" + projections +
                ", quantilePoints=" + quantilePoints +
                ", distancePower=" + distancePower +
                ", randomSeed=" + randomSeed +
                '}';
    }
}
