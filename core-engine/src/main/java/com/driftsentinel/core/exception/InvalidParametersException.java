package com.driftsentinel.core.exception;

/**
 * Raised when an estimator or the detector configuration receives a value
 * outside its legal range (e.g. {@code embeddingDimension < 2}).
 *
 * @since 1.0.0
 */
public class InvalidParametersException extends DriftDetectionException {

    private static final long serialVersionUID = 1L;

    public InvalidParametersException(String message) {
        super(message);
    }

    public InvalidParametersException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception for a single offending parameter.
     */
    public static InvalidParametersException invalidParameter(String name, Object value, String expected) {
        return new InvalidParametersException(
                String.format("Invalid parameter '%s': got '%s', expected %s", name, value, expected));
    }
}
