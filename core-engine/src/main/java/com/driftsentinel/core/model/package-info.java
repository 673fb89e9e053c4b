/**
 * Domain model classes for Drift Sentinel.
 *
 * <ul>
 * <li>{@link com.driftsentinel.core.model.NumericWindow} and
 * {@link com.driftsentinel.core.model.MultivariateSample} are the immutable
 * inputs of the estimators</li>
 * <li>{@link com.driftsentinel.core.model.Thresholds} and
 * {@link com.driftsentinel.core.model.DetectionResult} are the calibration
 * and per-window outputs of the detector</li>
 * <li>{@link com.driftsentinel.core.model.TelemetryWindow} and
 * {@link com.driftsentinel.core.model.DriftAlert} are the records exchanged
 * with the upstream source and the downstream consumer</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.model;
