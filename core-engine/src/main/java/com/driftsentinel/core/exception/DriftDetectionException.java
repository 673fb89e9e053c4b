package com.driftsentinel.core.exception;

/**
 * Base unchecked exception for every error raised by the drift detection
 * engine.
 *
 * <p>
 * All subclasses describe local, deterministic, caller-recoverable problems:
 * re-invoking with the same inputs fails the same way, so nothing in the
 * engine retries. A caller that catches one of these must treat the window
 * as <em>not evaluated</em>, never as "no drift".
 * </p>
 *
 * @since 1.0.0
 */
public class DriftDetectionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DriftDetectionException(String message) {
        super(message);
    }

    public DriftDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
