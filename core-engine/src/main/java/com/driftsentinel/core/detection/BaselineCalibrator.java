package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.DetectorConfig;
import com.driftsentinel.core.estimator.FractalDimensionEstimator;
import com.driftsentinel.core.estimator.OrdinalEntropyEstimator;
import com.driftsentinel.core.estimator.Percentiles;
import com.driftsentinel.core.estimator.SlicedDistanceEstimator;
import com.driftsentinel.core.estimator.SlicedDistanceEstimator.ProjectedReference;
import com.driftsentinel.core.exception.InsufficientBaselineException;
import com.driftsentinel.core.model.MultivariateSample;
import com.driftsentinel.core.model.NumericWindow;
import com.driftsentinel.core.model.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Derives detector thresholds from baseline data.
 *
 * <h3>Procedure</h3>
 * <ol>
 * <li>Every window of {@code windowSize} consecutive samples of the baseline
 * series (step 1) is scored with permutation entropy and fractal dimension;
 * the sentinel thresholds are the {@code sentinelPercentile}-th percentile of
 * each score.</li>
 * <li>Every window of {@code windowSize} consecutive rows of the reference
 * sample is compared against the whole reference with the sliced distance;
 * the confirm threshold is the {@code confirmPercentile}-th percentile of
 * these self-distances.</li>
 * </ol>
 *
 * <p>
 * Deterministic for a given seed. Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineCalibrator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineCalibrator.class);

    private BaselineCalibrator() {
        // utility class, not instantiable
    }

    /**
     * Calibrate against the given baseline.
     *
     * @param config    detector configuration; must not be {@code null}
     * @param series    univariate baseline history, at least {@code windowSize}
     *                  samples
     * @param reference multivariate reference, at least {@code windowSize} rows
     * @param seed      seed of the projection directions
     * @return the calibration
     * @throws InsufficientBaselineException if either baseline is too short
     */
    public static Calibration calibrate(DetectorConfig config, NumericWindow series,
            MultivariateSample reference, long seed) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        Objects.requireNonNull(series, "Baseline series must not be null");
        Objects.requireNonNull(reference, "Baseline reference must not be null");

        int windowSize = config.getWindowSize();
        if (series.size() < windowSize) {
            throw InsufficientBaselineException.insufficientData("baseline series samples", windowSize,
                    series.size());
        }
        if (reference.isEmpty()) {
            throw new InsufficientBaselineException("Baseline reference must not be empty");
        }
        if (reference.size() < windowSize) {
            throw InsufficientBaselineException.insufficientData("baseline reference rows", windowSize,
                    reference.size());
        }

        long startNanos = System.nanoTime();

        double[] samples = series.toArray();
        int seriesWindows = samples.length - windowSize + 1;
        double[] entropies = new double[seriesWindows];
        double[] dimensions = new double[seriesWindows];
        for (int start = 0; start < seriesWindows; start++) {
            double[] window = Arrays.copyOfRange(samples, start, start + windowSize);
            entropies[start] = OrdinalEntropyEstimator.permutationEntropy(
                    window, config.getEmbeddingDimension(), config.getDelay(), true);
            dimensions[start] = FractalDimensionEstimator.higuchiFractalDimension(window, config.getKmax());
        }

        double[][] directions = SlicedDistanceEstimator.drawDirections(
                config.getProjections(), reference.dimension(), new Random(seed));
        ProjectedReference projected = SlicedDistanceEstimator.projectReference(
                reference, directions, config.getQuantilePoints(), config.getDistancePower());

        int referenceWindows = reference.size() - windowSize + 1;
        double[] distances = new double[referenceWindows];
        for (int start = 0; start < referenceWindows; start++) {
            distances[start] = projected.distanceTo(reference, start, windowSize);
        }

        Thresholds thresholds = new Thresholds(
                Percentiles.percentile(entropies, config.getSentinelPercentile()),
                Percentiles.percentile(dimensions, config.getSentinelPercentile()),
                Percentiles.percentile(distances, config.getConfirmPercentile()));

        LOG.info("Calibrated on {} series window(s) and {} reference window(s) in {} ms: {}",
                seriesWindows, referenceWindows, (System.nanoTime() - startNanos) / 1_000_000, thresholds);
        return new Calibration(thresholds, reference, projected, seed);
    }
}
