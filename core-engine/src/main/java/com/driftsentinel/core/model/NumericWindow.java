package com.driftsentinel.core.model;

import com.driftsentinel.core.exception.InvalidParametersException;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, ordered sequence of samples representing one univariate
 * telemetry snapshot.
 *
 * <p>
 * The samples are copied on construction and on every {@link #toArray()}
 * call, so an instance can be shared freely between threads. Only finite
 * values are accepted.
 * </p>
 *
 * @since 1.0.0
 */
public final class NumericWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] values;

    private NumericWindow(double[] values) {
        this.values = values;
    }

    /**
     * Create a window from the given samples.
     *
     * @param values the samples, in temporal order; must not be {@code null}
     * @return a new window holding a copy of {@code values}
     * @throws InvalidParametersException if any sample is NaN or infinite
     */
    public static NumericWindow of(double... values) {
        Objects.requireNonNull(values, "Window values must not be null");
        double[] copy = values.clone();
        for (int i = 0; i < copy.length; i++) {
            if (!Double.isFinite(copy[i])) {
                throw InvalidParametersException.invalidParameter(
                        "values[" + i + "]", copy[i], "a finite number");
            }
        }
        return new NumericWindow(copy);
    }

    /**
     * Copy {@code length} samples starting at {@code from} out of this window.
     */
    public NumericWindow slice(int from, int length) {
        Objects.checkFromIndexSize(from, length, values.length);
        return new NumericWindow(Arrays.copyOfRange(values, from, from + length));
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * @return a fresh copy of the samples
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NumericWindow that))
            return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "NumericWindow{size=" + values.length + '}';
    }
}
