package com.edging.exception;

public class InvalidThresholdException extends EdgeDetectionException {

    public InvalidThresholdException(double low, double high) {
        super(ErrorKind.INVALID_THRESHOLD,
                "Thresholds must satisfy 0 <= low < high, got low=" + low + ", high=" + high);
    }
}
