package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Calibrated cutoff values, one per metric.
 *
 * <p>
 * Produced once per calibration and never mutated. Recalibration creates a
 * new instance and swaps it in as a whole.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ Thresholds.PERMUTATION_ENTROPY, Thresholds.FRACTAL_DIMENSION, Thresholds.SLICED_DISTANCE })
public final class Thresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String PERMUTATION_ENTROPY = "permutation_entropy";
    public static final String FRACTAL_DIMENSION = "fractal_dimension";
    public static final String SLICED_DISTANCE = "sliced_distance";

    private final double permutationEntropy;
    private final double fractalDimension;
    private final double slicedDistance;

    public Thresholds(double permutationEntropy, double fractalDimension, double slicedDistance) {
        this.permutationEntropy = permutationEntropy;
        this.fractalDimension = fractalDimension;
        this.slicedDistance = slicedDistance;
    }

    @JsonProperty(PERMUTATION_ENTROPY)
    public double getPermutationEntropy() {
        return permutationEntropy;
    }

    @JsonProperty(FRACTAL_DIMENSION)
    public double getFractalDimension() {
        return fractalDimension;
    }

    @JsonProperty(SLICED_DISTANCE)
    public double getSlicedDistance() {
        return slicedDistance;
    }

    /**
     * @return unmodifiable metric name to cutoff mapping, in a stable order
     */
    @JsonIgnore
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(PERMUTATION_ENTROPY, permutationEntropy);
        map.put(FRACTAL_DIMENSION, fractalDimension);
        map.put(SLICED_DISTANCE, slicedDistance);
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Thresholds that))
            return false;
        return Double.compare(permutationEntropy, that.permutationEntropy) == 0
                && Double.compare(fractalDimension, that.fractalDimension) == 0
                && Double.compare(slicedDistance, that.slicedDistance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(permutationEntropy, fractalDimension, slicedDistance);
    }

    @Override
    public String toString() {
        return "Thresholds" + asMap();
    }
}
