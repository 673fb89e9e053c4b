package com.driftsentinel.flink;

import com.driftsentinel.core.model.MultivariateSample;
import com.driftsentinel.core.model.NumericWindow;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Baseline document the job calibrates against.
 *
 * <pre>
 * {
 *   "series":    [0.12, -0.40, ...],
 *   "reference": [[0.1, 2.3], [0.0, 2.1], ...]
 * }
 * </pre>
 *
 * <p>
 * {@code reference} is optional; when absent the series doubles as a
 * one-feature reference sample.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineData {

    private double[] series;
    private double[][] reference;

    public BaselineData() {
    }

    public BaselineData(double[] series, double[][] reference) {
        this.series = series;
        this.reference = reference;
    }

    /**
     * @throws NullPointerException if the document has no {@code series}
     */
    public NumericWindow toSeries() {
        return NumericWindow.of(Objects.requireNonNull(series, "Baseline document has no 'series'"));
    }

    public MultivariateSample toReference() {
        return reference != null ? MultivariateSample.of(reference) : MultivariateSample.ofColumn(toSeries());
    }

    public double[] getSeries() {
        return series;
    }

    public void setSeries(double[] series) {
        this.series = series;
    }

    public double[][] getReference() {
        return reference;
    }

    public void setReference(double[][] reference) {
        this.reference = reference;
    }
}
