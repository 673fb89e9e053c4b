package com.driftsentinel.core.estimator;

import com.driftsentinel.core.exception.InvalidParametersException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Order-statistic helpers shared by the estimators and the calibrator.
 *
 * <p>
 * Both helpers interpolate linearly between adjacent order statistics, so a
 * percentile of {@code 0} is the minimum, {@code 100} the maximum, and the
 * quantile function of a single value is constant.
 * </p>
 *
 * @since 1.0.0
 */
public final class Percentiles {

    private Percentiles() {
        // utility class, not instantiable
    }

    /**
     * Linearly interpolated percentile of {@code values}.
     *
     * @param values     sample; must not be empty. Not modified.
     * @param percentile percentile in {@code [0, 100]}
     * @return the percentile value
     * @throws InvalidParametersException if {@code values} is empty or the
     *                                    percentile is out of range
     */
    public static double percentile(double[] values, double percentile) {
        Objects.requireNonNull(values, "Values must not be null");
        if (values.length == 0) {
            throw InvalidParametersException.invalidParameter("values.length", 0, "at least one value");
        }
        if (!(percentile >= 0.0 && percentile <= 100.0)) {
            throw InvalidParametersException.invalidParameter("percentile", percentile, "a value in [0, 100]");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        if (lower >= sorted.length - 1) {
            return sorted[sorted.length - 1];
        }
        double fraction = position - lower;
        return sorted[lower] + (sorted[lower + 1] - sorted[lower]) * fraction;
    }

    /**
     * Uniform grid of {@code points} values from 0 to 1 inclusive. A single
     * point grid is {@code [0.0]}.
     */
    public static double[] uniformGrid(int points) {
        if (points < 1) {
            throw InvalidParametersException.invalidParameter("points", points, ">= 1");
        }
        double[] grid = new double[points];
        if (points == 1) {
            return grid;
        }
        double step = 1.0 / (points - 1);
        for (int i = 0; i < points; i++) {
            grid[i] = i * step;
        }
        grid[points - 1] = 1.0;
        return grid;
    }

    /**
     * Evaluate the empirical quantile function of a sorted sample on
     * {@code grid}.
     *
     * <p>
     * The {@code i}-th order statistic sits at probability
     * {@code i / (n - 1)}; values in between are linearly interpolated.
     * </p>
     *
     * @param sorted ascending sample, at least one value
     * @param grid   probabilities in {@code [0, 1]}
     * @return quantile values, one per grid point
     */
    public static double[] quantileFunction(double[] sorted, double[] grid) {
        int n = sorted.length;
        double[] quantiles = new double[grid.length];
        if (n == 1) {
            Arrays.fill(quantiles, sorted[0]);
            return quantiles;
        }
        for (int i = 0; i < grid.length; i++) {
            double position = grid[i] * (n - 1);
            int lower = (int) Math.floor(position);
            if (lower >= n - 1) {
                quantiles[i] = sorted[n - 1];
            } else if (lower < 0) {
                quantiles[i] = sorted[0];
            } else {
                double fraction = position - lower;
                quantiles[i] = sorted[lower] + (sorted[lower + 1] - sorted[lower]) * fraction;
            }
        }
        return quantiles;
    }
}
