package com.driftsentinel.core.exception;

/**
 * Raised when two samples that are compared feature-by-feature do not share
 * the same number of features.
 *
 * @since 1.0.0
 */
public class DimensionMismatchException extends DriftDetectionException {

    private static final long serialVersionUID = 1L;

    private final int left;
    private final int right;

    public DimensionMismatchException(int left, int right) {
        super(String.format("Samples must share the same number of features: %d != %d", left, right));
        this.left = left;
        this.right = right;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }
}
