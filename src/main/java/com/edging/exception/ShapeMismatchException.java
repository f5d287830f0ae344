package com.edging.exception;

/**
 * Array, kernel or channel-count incompatibility.
 */
public class ShapeMismatchException extends EdgeDetectionException {

    public ShapeMismatchException(String message) {
        super(ErrorKind.SHAPE_MISMATCH, message);
    }
}
