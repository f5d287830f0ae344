package com.edging.exception;

import lombok.Getter;

/**
 * Base of every precondition failure raised by the filtering pipeline.
 * Raised synchronously at the violated precondition; no stage produces partial output.
 */
@Getter
public abstract class EdgeDetectionException extends IllegalArgumentException {

    private final ErrorKind kind;

    protected EdgeDetectionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
