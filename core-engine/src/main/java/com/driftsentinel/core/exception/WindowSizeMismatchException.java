package com.driftsentinel.core.exception;

/**
 * Raised when a window handed to the detector does not have the configured
 * number of samples (or rows, for a multivariate observation).
 *
 * @since 1.0.0
 */
public class WindowSizeMismatchException extends DriftDetectionException {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public WindowSizeMismatchException(String what, int expected, int actual) {
        super(String.format("%s must match the configured window size (%d), got %d", what, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
