package com.driftsentinel.core.model;

import com.driftsentinel.core.exception.DimensionMismatchException;
import com.driftsentinel.core.exception.InvalidParametersException;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, ordered sequence of feature vectors (rows) of equal
 * dimensionality.
 *
 * <p>
 * Used both as the long-term reference distribution and as the optional
 * per-window observation handed to the confirm layer. A univariate series is
 * represented as a single-feature sample via {@link #ofColumn(double...)}.
 * </p>
 *
 * <p>
 * An empty sample is legal and reports a dimension of {@code 0}; it is the
 * consumers that decide whether emptiness is an error.
 * </p>
 *
 * @since 1.0.0
 */
public final class MultivariateSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[][] rows;
    private final int dimension;

    private MultivariateSample(double[][] rows, int dimension) {
        this.rows = rows;
        this.dimension = dimension;
    }

    /**
     * Create a sample from row vectors.
     *
     * @param rows feature vectors; must not be {@code null}
     * @return a new sample holding a deep copy of {@code rows}
     * @throws DimensionMismatchException if the rows differ in length
     * @throws InvalidParametersException if a row is {@code null} or empty, or
     *                                    a value is not finite
     */
    public static MultivariateSample of(double[][] rows) {
        Objects.requireNonNull(rows, "Sample rows must not be null");
        if (rows.length == 0) {
            return new MultivariateSample(new double[0][], 0);
        }
        int dimension = requireRow(rows, 0).length;
        if (dimension == 0) {
            throw InvalidParametersException.invalidParameter("rows[0].length", 0, "at least one feature");
        }
        double[][] copy = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            double[] row = requireRow(rows, r);
            if (row.length != dimension) {
                throw new DimensionMismatchException(dimension, row.length);
            }
            for (int c = 0; c < dimension; c++) {
                if (!Double.isFinite(row[c])) {
                    throw InvalidParametersException.invalidParameter(
                            "rows[" + r + "][" + c + "]", row[c], "a finite number");
                }
            }
            copy[r] = row.clone();
        }
        return new MultivariateSample(copy, dimension);
    }

    private static double[] requireRow(double[][] rows, int index) {
        if (rows[index] == null) {
            throw InvalidParametersException.invalidParameter("rows[" + index + "]", null, "a feature vector");
        }
        return rows[index];
    }

    /**
     * Treat a sequence of scalars as a single-feature sample.
     */
    public static MultivariateSample ofColumn(double... values) {
        Objects.requireNonNull(values, "Column values must not be null");
        double[][] rows = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            rows[i] = new double[] { values[i] };
        }
        return of(rows);
    }

    /**
     * Treat a univariate window as a single-feature sample.
     */
    public static MultivariateSample ofColumn(NumericWindow window) {
        Objects.requireNonNull(window, "Window must not be null");
        return ofColumn(window.toArray());
    }

    public int size() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    /**
     * @return number of features per row, {@code 0} for an empty sample
     */
    public int dimension() {
        return dimension;
    }

    public double get(int row, int feature) {
        return rows[row][feature];
    }

    /**
     * @return a copy of the requested row
     */
    public double[] row(int index) {
        return rows[index].clone();
    }

    /**
     * Project every row onto {@code direction} (dot product).
     *
     * @param direction vector with {@link #dimension()} components
     * @return one scalar per row
     */
    public double[] project(double[] direction) {
        return project(direction, 0, rows.length);
    }

    /**
     * Project {@code count} consecutive rows, starting at {@code from}, onto
     * {@code direction}.
     *
     * @throws DimensionMismatchException if {@code direction} does not have
     *                                    {@link #dimension()} components
     */
    public double[] project(double[] direction, int from, int count) {
        Objects.requireNonNull(direction, "Direction must not be null");
        if (direction.length != dimension) {
            throw new DimensionMismatchException(dimension, direction.length);
        }
        Objects.checkFromIndexSize(from, count, rows.length);
        double[] projected = new double[count];
        for (int r = 0; r < count; r++) {
            double[] row = rows[from + r];
            double dot = 0.0;
            for (int c = 0; c < dimension; c++) {
                dot += row[c] * direction[c];
            }
            projected[r] = dot;
        }
        return projected;
    }

    /**
     * Copy {@code length} consecutive rows starting at {@code from}.
     */
    public MultivariateSample slice(int from, int length) {
        Objects.checkFromIndexSize(from, length, rows.length);
        double[][] copy = new double[length][];
        for (int r = 0; r < length; r++) {
            copy[r] = rows[from + r].clone();
        }
        return new MultivariateSample(copy, length == 0 ? 0 : dimension);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MultivariateSample that))
            return false;
        return Arrays.deepEquals(rows, that.rows);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(rows);
    }

    @Override
    public String toString() {
        return "MultivariateSample{rows=" + rows.length + ", dimension=" + dimension + '}';
    }
}
