package com.driftsentinel.core.estimator;

import com.driftsentinel.core.exception.InvalidParametersException;
import com.driftsentinel.core.model.NumericWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Higuchi fractal dimension of a univariate window.
 *
 * <h3>Algorithm</h3>
 * <p>
 * For each scale {@code k} in {@code [1, kmax]} and each offset {@code m} in
 * {@code [0, k)} the sub-series {@code x[m], x[m+k], x[m+2k], ...} is
 * formed; sub-series with fewer than two points are skipped. Its curve length
 * is {@code (n - 1) / (size * k) * sum(|diff|)}. The lengths are averaged per
 * scale, non-positive averages are discarded, and the value returned is the
 * least-squares slope of {@code ln L(k)} against {@code ln k}.
 * </p>
 *
 * <p>
 * The raw slope is reported as is, without negation. With this length
 * normalization a smooth curve lands near {@code 0} and white noise near
 * {@code -1}, i.e. the value equals {@code 1 - D} for a classical Higuchi
 * dimension {@code D}. Calibrated thresholds are defined on the raw slope.
 * </p>
 *
 * <p>
 * When every scale is degenerate (e.g. a flat signal) the neutral value
 * {@value #DEGENERATE_DIMENSION} is returned instead of failing.
 * </p>
 *
 * @since 1.0.0
 */
public final class FractalDimensionEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(FractalDimensionEstimator.class);

    /** Returned when no scale yields a positive curve length. */
    public static final double DEGENERATE_DIMENSION = 1.0;

    private FractalDimensionEstimator() {
        // utility class, not instantiable
    }

    /**
     * @see #higuchiFractalDimension(double[], int)
     */
    public static double higuchiFractalDimension(NumericWindow window, int kmax) {
        Objects.requireNonNull(window, "Window must not be null");
        return higuchiFractalDimension(window.toArray(), kmax);
    }

    /**
     * Estimate the Higuchi fractal dimension of {@code values}.
     *
     * @param values univariate samples, at least two; not modified
     * @param kmax   largest scale, {@code >= 2}
     * @return the raw log-log slope, or {@value #DEGENERATE_DIMENSION} if all
     *         scales are degenerate
     * @throws InvalidParametersException if {@code values} has fewer than two
     *                                    samples or {@code kmax < 2}
     */
    public static double higuchiFractalDimension(double[] values, int kmax) {
        Objects.requireNonNull(values, "Values must not be null");
        int n = values.length;
        if (n < 2) {
            throw InvalidParametersException.invalidParameter("values.length", n, ">= 2");
        }
        if (kmax < 2) {
            throw InvalidParametersException.invalidParameter("kmax", kmax, ">= 2");
        }

        double[] logK = new double[kmax];
        double[] logLength = new double[kmax];
        int valid = 0;

        for (int k = 1; k <= kmax; k++) {
            double lengthSum = 0.0;
            int offsets = 0;
            for (int m = 0; m < k; m++) {
                int size = (n - m + k - 1) / k;
                if (size < 2) {
                    continue;
                }
                double variation = 0.0;
                for (int i = m + k; i < n; i += k) {
                    variation += Math.abs(values[i] - values[i - k]);
                }
                lengthSum += variation * (n - 1) / ((double) size * k);
                offsets++;
            }
            double meanLength = offsets == 0 ? 0.0 : lengthSum / offsets;
            if (meanLength > 0.0) {
                logK[valid] = Math.log(k);
                logLength[valid] = Math.log(meanLength);
                valid++;
            }
        }

        if (valid == 0) {
            LOG.trace("All {} Higuchi scale(s) degenerate, returning {}", kmax, DEGENERATE_DIMENSION);
            return DEGENERATE_DIMENSION;
        }
        return slope(logK, logLength, valid);
    }

    /**
     * Least-squares slope over the first {@code count} points.
     *
     * <p>
     * A single point is solved as the minimum-norm solution of the
     * column-scaled design matrix, which gives {@code y / (2x)}, or {@code 0}
     * when {@code x == 0}.
     * </p>
     */
    static double slope(double[] x, double[] y, int count) {
        if (count == 1) {
            return x[0] == 0.0 ? 0.0 : y[0] / (2.0 * x[0]);
        }
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < count; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= count;
        meanY /= count;

        double covariance = 0.0;
        double variance = 0.0;
        for (int i = 0; i < count; i++) {
            double dx = x[i] - meanX;
            covariance += dx * (y[i] - meanY);
            variance += dx * dx;
        }
        return covariance / variance;
    }
}
