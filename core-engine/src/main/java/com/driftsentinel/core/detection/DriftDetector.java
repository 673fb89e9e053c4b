package com.driftsentinel.core.detection;

import com.driftsentinel.core.model.DetectionResult;
import com.driftsentinel.core.model.DetectorState;
import com.driftsentinel.core.model.MultivariateSample;
import com.driftsentinel.core.model.NumericWindow;
import com.driftsentinel.core.model.Thresholds;

import java.io.Serializable;

/**
 * Contract for streaming drift detectors.
 * <p>
 * Implementations are <strong>stateful</strong>: each instance is bound to a
 * single telemetry stream and its verdicts depend on the order of
 * consecutive {@link #check} calls. Calls for one instance must therefore be
 * made in the temporal order of the windows.
 * </p>
 * <p>
 * Detectors are {@link Serializable} so stream processors can keep them in
 * checkpointed keyed state.
 * </p>
 */
public interface DriftDetector extends Serializable {

    /**
     * Evaluate one univariate window.
     *
     * @param window the window to evaluate
     * @return a fresh result for this window
     * @throws com.driftsentinel.core.exception.DriftDetectionException if the
     *         window could not be evaluated
     */
    DetectionResult check(NumericWindow window);

    /**
     * Evaluate one univariate window together with a richer observation for
     * the confirm layer.
     *
     * @param window      the window to evaluate
     * @param observation multivariate snapshot aligned with {@code window}, or
     *                    {@code null} to confirm on {@code window} itself
     * @return a fresh result for this window
     * @throws com.driftsentinel.core.exception.DriftDetectionException if the
     *         window could not be evaluated
     */
    DetectionResult check(NumericWindow window, MultivariateSample observation);

    /**
     * Derive new thresholds from fresh baseline data and swap them in as one
     * unit. Partial drift evidence is kept.
     */
    void recalibrate(NumericWindow baselineSeries, MultivariateSample baselineReference);

    /**
     * Forget partial drift evidence.
     */
    void resetHysteresis();

    /**
     * @return the state derived from the current hysteresis count
     */
    DetectorState getState();

    /**
     * @return thresholds currently in effect
     */
    Thresholds getThresholds();
}
