package com.driftsentinel.core.estimator;

import com.driftsentinel.core.exception.DimensionMismatchException;
import com.driftsentinel.core.exception.InvalidParametersException;
import com.driftsentinel.core.model.MultivariateSample;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Monte-Carlo estimate of the Wasserstein-{@code p} distance between two
 * empirical samples by averaging one-dimensional distances over random
 * projection directions.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Draw {@code nProjections} directions from a seeded {@link Random}: each
 * component is standard normal, the vector is divided by its norm.</li>
 * <li>Project both samples onto a direction and evaluate each sample's
 * empirical quantile function on a uniform grid of {@code quantilePoints}
 * probabilities.</li>
 * <li>The direction's distance is the {@code p}-th root of the mean
 * {@code |qx - qy|^p}; the directions' distances are averaged.</li>
 * </ol>
 *
 * <p>
 * The result is an estimate, not an exact Wasserstein distance. For a fixed
 * seed it is bit-for-bit reproducible, exactly zero for a sample against
 * itself, and symmetric in its two arguments.
 * </p>
 *
 * <h3>Fixed directions</h3>
 * <p>
 * When many samples are compared against the same reference with the same
 * directions, {@link #projectReference} precomputes the reference side once.
 * {@link ProjectedReference#distanceTo(MultivariateSample)} returns exactly
 * what {@link #slicedDistance} would for the same directions.
 * </p>
 *
 * @since 1.0.0
 */
public final class SlicedDistanceEstimator {

    /** Added to a direction's norm before dividing. */
    static final double NORM_EPSILON = 1e-12;

    private SlicedDistanceEstimator() {
        // utility class, not instantiable
    }

    /**
     * Estimate the sliced distance with directions drawn from
     * {@code new Random(seed)}.
     *
     * @see #slicedDistance(MultivariateSample, MultivariateSample, int, int, int, Random)
     */
    public static double slicedDistance(MultivariateSample x, MultivariateSample y,
            int nProjections, int quantilePoints, int power, long seed) {
        return slicedDistance(x, y, nProjections, quantilePoints, power, new Random(seed));
    }

    /**
     * Estimate the sliced distance between {@code x} and {@code y}.
     *
     * @param x              first sample, non-empty
     * @param y              second sample, non-empty, same dimensionality as
     *                       {@code x}
     * @param nProjections   number of random directions, {@code >= 1}
     * @param quantilePoints grid size for the quantile functions, {@code >= 1}
     * @param power          Wasserstein order {@code p}, {@code >= 1}
     * @param random         source of the directions; consumed
     * @return the averaged per-direction distance
     * @throws DimensionMismatchException if the samples differ in dimensionality
     * @throws InvalidParametersException if a sample is empty or a parameter is
     *                                    out of range
     */
    public static double slicedDistance(MultivariateSample x, MultivariateSample y,
            int nProjections, int quantilePoints, int power, Random random) {
        Objects.requireNonNull(x, "Sample x must not be null");
        Objects.requireNonNull(y, "Sample y must not be null");
        Objects.requireNonNull(random, "Random source must not be null");
        requireNonEmpty(x, "x");
        requireNonEmpty(y, "y");
        if (x.dimension() != y.dimension()) {
            throw new DimensionMismatchException(x.dimension(), y.dimension());
        }
        double[][] directions = drawDirections(nProjections, x.dimension(), random);
        return projectReference(y, directions, quantilePoints, power).distanceTo(x);
    }

    /**
     * Draw {@code count} unit directions in {@code dimension}-space.
     *
     * @throws InvalidParametersException if {@code count} or {@code dimension}
     *                                    is below 1
     */
    public static double[][] drawDirections(int count, int dimension, Random random) {
        Objects.requireNonNull(random, "Random source must not be null");
        if (count < 1) {
            throw InvalidParametersException.invalidParameter("nProjections", count, ">= 1");
        }
        if (dimension < 1) {
            throw InvalidParametersException.invalidParameter("dimension", dimension, ">= 1");
        }
        double[][] directions = new double[count][dimension];
        for (double[] direction : directions) {
            double squared = 0.0;
            for (int c = 0; c < dimension; c++) {
                direction[c] = random.nextGaussian();
                squared += direction[c] * direction[c];
            }
            double norm = Math.sqrt(squared) + NORM_EPSILON;
            for (int c = 0; c < dimension; c++) {
                direction[c] /= norm;
            }
        }
        return directions;
    }

    /**
     * Precompute the quantile functions of {@code reference} along each of
     * {@code directions}.
     *
     * @throws InvalidParametersException if the reference is empty or a
     *                                    parameter is out of range
     * @throws DimensionMismatchException if a direction does not match the
     *                                    reference dimensionality
     */
    public static ProjectedReference projectReference(MultivariateSample reference, double[][] directions,
            int quantilePoints, int power) {
        Objects.requireNonNull(reference, "Reference must not be null");
        Objects.requireNonNull(directions, "Directions must not be null");
        requireNonEmpty(reference, "reference");
        if (directions.length < 1) {
            throw InvalidParametersException.invalidParameter("nProjections", directions.length, ">= 1");
        }
        if (power < 1) {
            throw InvalidParametersException.invalidParameter("power", power, ">= 1");
        }
        double[] grid = Percentiles.uniformGrid(quantilePoints);
        double[][] copies = new double[directions.length][];
        double[][] quantiles = new double[directions.length][];
        for (int d = 0; d < directions.length; d++) {
            copies[d] = directions[d].clone();
            quantiles[d] = sortedQuantiles(reference.project(copies[d]), grid);
        }
        return new ProjectedReference(copies, quantiles, grid, power, reference.dimension());
    }

    private static double[] sortedQuantiles(double[] projected, double[] grid) {
        Arrays.sort(projected);
        return Percentiles.quantileFunction(projected, grid);
    }

    private static void requireNonEmpty(MultivariateSample sample, String name) {
        if (sample.isEmpty()) {
            throw InvalidParametersException.invalidParameter(name + ".size", 0, "at least one row");
        }
    }

    /**
     * Reference sample reduced to its quantile functions along a fixed set of
     * directions. Immutable.
     */
    public static final class ProjectedReference implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double[][] directions;
        private final double[][] quantiles;
        private final double[] grid;
        private final int power;
        private final int dimension;

        private ProjectedReference(double[][] directions, double[][] quantiles, double[] grid, int power,
                int dimension) {
            this.directions = directions;
            this.quantiles = quantiles;
            this.grid = grid;
            this.power = power;
            this.dimension = dimension;
        }

        /**
         * Sliced distance from {@code sample} to the reference.
         */
        public double distanceTo(MultivariateSample sample) {
            Objects.requireNonNull(sample, "Sample must not be null");
            return distanceTo(sample, 0, sample.size());
        }

        /**
         * Sliced distance from rows {@code [from, from + count)} of
         * {@code sample} to the reference.
         *
         * @throws InvalidParametersException if {@code count} is zero
         * @throws DimensionMismatchException if {@code sample} does not match the
         *                                    reference dimensionality
         */
        public double distanceTo(MultivariateSample sample, int from, int count) {
            Objects.requireNonNull(sample, "Sample must not be null");
            if (count < 1) {
                throw InvalidParametersException.invalidParameter("sample.size", count, "at least one row");
            }
            if (sample.dimension() != dimension) {
                throw new DimensionMismatchException(sample.dimension(), dimension);
            }
            double total = 0.0;
            for (int d = 0; d < directions.length; d++) {
                double[] sampleQuantiles = sortedQuantiles(sample.project(directions[d], from, count), grid);
                total += directionalDistance(sampleQuantiles, quantiles[d]);
            }
            return total / directions.length;
        }

        private double directionalDistance(double[] qx, double[] qy) {
            double sum = 0.0;
            for (int i = 0; i < qx.length; i++) {
                sum += Math.pow(Math.abs(qx[i] - qy[i]), power);
            }
            return Math.pow(sum / qx.length, 1.0 / power);
        }

        public int projections() {
            return directions.length;
        }

        public int dimension() {
            return dimension;
        }
    }
}
