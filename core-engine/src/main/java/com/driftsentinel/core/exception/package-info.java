/**
 * Typed error taxonomy of the drift detection engine.
 *
 * <p>
 * Every exception extends
 * {@link com.driftsentinel.core.exception.DriftDetectionException}, an
 * unchecked exception, so callers can catch the whole family in one place and
 * route it to their own observability layer.
 * </p>
 *
 * @since 1.0.0
 */
package com.driftsentinel.core.exception;
