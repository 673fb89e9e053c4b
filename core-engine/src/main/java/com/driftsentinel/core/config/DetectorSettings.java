package com.driftsentinel.core.config;

/**
 * Mutable POJO bound to the detector YAML file by SnakeYAML.
 *
 * <p>
 * Expected YAML structure (every key optional):
 * </p>
 *
 * <pre>
 * windowSize: 64
 * sentinelPercentile: 95
 * confirmPercentile: 95
 * consecutiveSentinels: 3
 * embeddingDimension: 4
 * delay: 1
 * kmax: 8
 * projections: 100
 * quantilePoints: 128
 * distancePower: 2
 * randomSeed: 42
 * </pre>
 *
 * <p>
 * Call {@link #toConfig()} to validate and obtain the immutable
 * {@link DetectorConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings {

    private int windowSize = DetectorConfig.DEFAULT_WINDOW_SIZE;
    private double sentinelPercentile = DetectorConfig.DEFAULT_PERCENTILE;
    private double confirmPercentile = DetectorConfig.DEFAULT_PERCENTILE;
    private int consecutiveSentinels = DetectorConfig.DEFAULT_CONSECUTIVE_SENTINELS;
    private int embeddingDimension = DetectorConfig.DEFAULT_EMBEDDING_DIMENSION;
    private int delay = DetectorConfig.DEFAULT_DELAY;
    private int kmax = DetectorConfig.DEFAULT_KMAX;
    private int projections = DetectorConfig.DEFAULT_PROJECTIONS;
    private int quantilePoints = DetectorConfig.DEFAULT_QUANTILE_POINTS;
    private int distancePower = DetectorConfig.DEFAULT_DISTANCE_POWER;
    private Long randomSeed;

    /**
     * Validate these settings and convert them.
     *
     * @return the immutable configuration
     * @throws com.driftsentinel.core.exception.InvalidParametersException if
     *         any value is out of range
     */
    public DetectorConfig toConfig() {
        return DetectorConfig.builder()
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
                .randomSeed(randomSeed)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getSentinelPercentile() {
        return sentinelPercentile;
    }

    public void setSentinelPercentile(double sentinelPercentile) {
        this.sentinelPercentile = sentinelPercentile;
    }

    public double getConfirmPercentile() {
        return confirmPercentile;
    }

    public void setConfirmPercentile(double confirmPercentile) {
        this.confirmPercentile = confirmPercentile;
    }

    public int getConsecutiveSentinels() {
        return consecutiveSentinels;
    }

    public void setConsecutiveSentinels(int consecutiveSentinels) {
        this.consecutiveSentinels = consecutiveSentinels;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public void setEmbeddingDimension(int embeddingDimension) {
        this.embeddingDimension = embeddingDimension;
    }

    public int getDelay() {
        return delay;
    }

    public void setDelay(int delay) {
        this.delay = delay;
    }

    public int getKmax() {
        return kmax;
    }

    public void setKmax(int kmax) {
        this.kmax = kmax;
    }

    public int getProjections() {
        return projections;
    }

    public void setProjections(int projections) {
        this.projections = projections;
    }

    public int getQuantilePoints() {
        return quantilePoints;
    }

    public void setQuantilePoints(int quantilePoints) {
        this.quantilePoints = quantilePoints;
    }

    public int getDistancePower() {
        return distancePower;
    }

    public void setDistancePower(int distancePower) {
        this.distancePower = distancePower;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "windowSize=" + windowSize +
                ", sentinelPercentile=" + sentinelPercentile +
                ", confirmPercentile=" + confirmPercentile +
                ", consecutiveSentinels=" + consecutiveSentinels +
                ", projections=" + projections +
                ", randomSeed=" + randomSeed +
                '}';
    }
}
