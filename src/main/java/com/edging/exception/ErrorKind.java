package com.edging.exception;

public enum ErrorKind {
    SHAPE_MISMATCH,
    INDEX_OUT_OF_BOUNDS,
    KERNEL_TOO_LARGE,
    INVALID_THRESHOLD
}
