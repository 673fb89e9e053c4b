/**
 * Layered drift detection engine.
 *
 * <p>
 * {@link com.driftsentinel.core.detection.LayeredDriftDetector} is the only
 * stateful component: it is calibrated once by
 * {@link com.driftsentinel.core.detection.BaselineCalibrator} and then
 * classifies each telemetry window through a cheap sentinel layer and, after
 * enough consecutive sentinel triggers, an expensive confirm layer.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * One detector instance per monitored stream. Independent instances share no
 * state and may run in parallel.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.detection;
