package com.driftsentinel.core.exception;

/**
 * Raised when calibration input is too small to derive a threshold from.
 *
 * @since 1.0.0
 */
public class InsufficientBaselineException extends DriftDetectionException {

    private static final long serialVersionUID = 1L;

    public InsufficientBaselineException(String message) {
        super(message);
    }

    /**
     * Creates an exception for a baseline that is shorter than required.
     */
    public static InsufficientBaselineException insufficientData(String what, int required, int actual) {
        return new InsufficientBaselineException(
                String.format("Insufficient %s: need at least %d, but got %d", what, required, actual));
    }
}
