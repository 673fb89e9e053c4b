/**
 * Pure numerical estimators used by the layered drift detector.
 *
 * <ul>
 * <li>{@link com.driftsentinel.core.estimator.OrdinalEntropyEstimator}:
 * permutation entropy (sentinel layer)</li>
 * <li>{@link com.driftsentinel.core.estimator.FractalDimensionEstimator}:
 * Higuchi fractal dimension (sentinel layer)</li>
 * <li>{@link com.driftsentinel.core.estimator.SlicedDistanceEstimator}:
 * sliced Wasserstein distance (confirm layer)</li>
 * </ul>
 *
 * <p>
 * None of them holds state; the sliced distance only consumes the random
 * source it is handed.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.estimator;
