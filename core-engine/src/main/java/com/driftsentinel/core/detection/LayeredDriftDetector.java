package com.driftsentinel.core.detection;

import com.driftsentinel.core.config.DetectorConfig;
import com.driftsentinel.core.estimator.FractalDimensionEstimator;
import com.driftsentinel.core.estimator.OrdinalEntropyEstimator;
import com.driftsentinel.core.exception.DimensionMismatchException;
import com.driftsentinel.core.exception.InvalidParametersException;
import com.driftsentinel.core.exception.WindowSizeMismatchException;
import com.driftsentinel.core.model.DetectionResult;
import com.driftsentinel.core.model.DetectorState;
import com.driftsentinel.core.model.MultivariateSample;
import com.driftsentinel.core.model.NumericWindow;
import com.driftsentinel.core.model.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Two-stage drift detector.
 *
 * <h3>Layers</h3>
 * <ul>
 * <li><b>Sentinel</b> (every window): permutation entropy and Higuchi fractal
 * dimension of the window. The sentinel triggers when either exceeds its
 * calibrated threshold.</li>
 * <li><b>Confirm</b> (only after {@code consecutiveSentinels} consecutive
 * sentinel triggers): sliced distance between the observation and the
 * reference sample. An alert is raised when this exceeds its threshold
 * too.</li>
 * </ul>
 *
 * <h3>State</h3>
 * <p>
 * The only mutable state is the hysteresis counter: incremented on every
 * sentinel-triggering window and reset to zero on any other window.
 * {@link #check} is {@code synchronized}, so concurrent callers are
 * serialized, but they must still submit windows in temporal order for the
 * counter to mean "consecutive".
 * </p>
 *
 * <h3>Recalibration</h3>
 * <p>
 * {@link #recalibrate} computes a new {@link Calibration} without holding
 * the lock and publishes it with a single volatile write. A concurrent
 * {@code check} sees either the old or the new calibration, never a mix. The
 * hysteresis counter is untouched; use {@link #resetHysteresis()} to clear
 * it.
 * </p>
 *
 * <h3>Randomness</h3>
 * <p>
 * Projection directions come from the configured seed, or from a seed drawn
 * once at construction. Either way they are fixed for the detector's
 * lifetime, so results are reproducible across calibration and detection.
 * </p>
 *
 * @since 1.0.0
 */
public class LayeredDriftDetector implements DriftDetector {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LayeredDriftDetector.class);

    private final DetectorConfig config;

    private volatile Calibration calibration;

    /** Consecutive sentinel-triggering windows; guarded by {@code this}. */
    private int hysteresisCount;

    /**
     * Calibrate a new detector against baseline data.
     *
     * @param config            detector configuration; must not be {@code null}
     * @param baselineSeries    univariate history, at least {@code windowSize}
     *                          samples
     * @param baselineReference reference sample, at least {@code windowSize}
     *                          rows
     * @throws com.driftsentinel.core.exception.InsufficientBaselineException if
     *         a baseline is too short
     */
    public LayeredDriftDetector(DetectorConfig config, NumericWindow baselineSeries,
            MultivariateSample baselineReference) {
        this(config, BaselineCalibrator.calibrate(
                Objects.requireNonNull(config, "DetectorConfig must not be null"),
                baselineSeries, baselineReference, resolveSeed(config)));
    }

    /**
     * Create a detector from an existing calibration, e.g. one computed once
     * and shared by many per-stream detectors.
     *
     * @param config      the configuration the calibration was computed with
     * @param calibration the calibration; must not be {@code null}
     */
    public LayeredDriftDetector(DetectorConfig config, Calibration calibration) {
        this(config, calibration, 0);
    }

    /**
     * Rebuild a detector around a previously observed hysteresis count, e.g.
     * one restored from per-stream state.
     *
     * @param config          the configuration the calibration was computed with
     * @param calibration     the calibration; must not be {@code null}
     * @param hysteresisCount the restored streak; must not be negative
     * @throws InvalidParametersException if {@code hysteresisCount} is negative
     */
    public LayeredDriftDetector(DetectorConfig config, Calibration calibration, int hysteresisCount) {
        this.config = Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.calibration = Objects.requireNonNull(calibration, "Calibration must not be null");
        if (hysteresisCount < 0) {
            throw InvalidParametersException.invalidParameter("hysteresisCount", hysteresisCount, "a value >= 0");
        }
        this.hysteresisCount = hysteresisCount;
    }

    /**
     * Seed used for projection directions: the configured one, or a freshly
     * drawn one.
     */
    public static long resolveSeed(DetectorConfig config) {
        return config.getRandomSeed().orElseGet(() -> ThreadLocalRandom.current().nextLong());
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    @Override
    public DetectionResult check(NumericWindow window) {
        return check(window, null);
    }

    @Override
    public synchronized DetectionResult check(NumericWindow window, MultivariateSample observation) {
        Objects.requireNonNull(window, "Window must not be null");
        if (window.size() != config.getWindowSize()) {
            throw new WindowSizeMismatchException("window", config.getWindowSize(), window.size());
        }
        Calibration current = calibration;

        double pe = OrdinalEntropyEstimator.permutationEntropy(
                window, config.getEmbeddingDimension(), config.getDelay(), true);
        double hfd = FractalDimensionEstimator.higuchiFractalDimension(window, config.getKmax());

        Thresholds thresholds = current.getThresholds();
        boolean entropyTriggered = pe > thresholds.getPermutationEntropy();
        boolean fractalTriggered = hfd > thresholds.getFractalDimension();

        int nextCount;
        if (entropyTriggered || fractalTriggered) {
            nextCount = hysteresisCount < Integer.MAX_VALUE ? hysteresisCount + 1 : hysteresisCount;
        } else {
            nextCount = 0;
        }
        boolean confirm = nextCount >= config.getConsecutiveSentinels();

        // The observation only matters to the confirm layer; reject it before the counter moves.
        MultivariateSample sample = null;
        if (confirm) {
            sample = resolveObservation(window, observation, current);
        }
        hysteresisCount = nextCount;

        DetectionResult.Builder result = DetectionResult.builder()
                .permutationEntropy(pe)
                .fractalDimension(hfd)
                .entropyTriggered(entropyTriggered)
                .fractalTriggered(fractalTriggered)
                .hysteresisCount(hysteresisCount)
                .state(DetectorState.of(hysteresisCount, config.getConsecutiveSentinels()))
                .thresholds(thresholds);

        if (confirm) {
            double distance = current.getProjectedReference().distanceTo(sample);
            boolean confirmTriggered = distance > thresholds.getSlicedDistance();
            result.confirm(distance, confirmTriggered);
            LOG.debug("Confirm layer ran: distance={} threshold={} triggered={}",
                    distance, thresholds.getSlicedDistance(), confirmTriggered);
        }

        DetectionResult detection = result.build();
        LOG.debug("Window evaluated: pe={} hfd={} sentinel={} count={} alert={}",
                pe, hfd, detection.isSentinelTriggered(), hysteresisCount, detection.isAlert());
        return detection;
    }

    private MultivariateSample resolveObservation(NumericWindow window, MultivariateSample observation,
            Calibration current) {
        int referenceDimension = current.getReference().dimension();
        if (observation == null) {
            if (referenceDimension != 1) {
                throw new DimensionMismatchException(1, referenceDimension);
            }
            return MultivariateSample.ofColumn(window);
        }
        if (observation.size() != config.getWindowSize()) {
            throw new WindowSizeMismatchException("multivariate observation rows", config.getWindowSize(),
                    observation.size());
        }
        if (observation.dimension() != referenceDimension) {
            throw new DimensionMismatchException(observation.dimension(), referenceDimension);
        }
        return observation;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void recalibrate(NumericWindow baselineSeries, MultivariateSample baselineReference) {
        Calibration next = BaselineCalibrator.calibrate(
                config, baselineSeries, baselineReference, calibration.getSeed());
        calibration = next;
        LOG.info("Detector recalibrated: {}", next.getThresholds());
    }

    @Override
    public synchronized void resetHysteresis() {
        if (hysteresisCount != 0) {
            LOG.debug("Hysteresis reset from {}", hysteresisCount);
        }
        hysteresisCount = 0;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @Override
    public synchronized DetectorState getState() {
        return DetectorState.of(hysteresisCount, config.getConsecutiveSentinels());
    }

    public synchronized int getHysteresisCount() {
        return hysteresisCount;
    }

    @Override
    public Thresholds getThresholds() {
        return calibration.getThresholds();
    }

    public Calibration getCalibration() {
        return calibration;
    }

    public DetectorConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "LayeredDriftDetector{" +
                "thresholds=" + getThresholds() +
                ", state=" + getState() +
                '}';
    }
}
