package com.edging.exception;

/**
 * Border reflection cannot resolve an index within a single reflection pass.
 * Keep the kernel radius below min(rows, cols).
 */
public class KernelTooLargeException extends EdgeDetectionException {

    public KernelTooLargeException(int index, int extent) {
        super(ErrorKind.KERNEL_TOO_LARGE,
                "Index " + index + " cannot be reflected into an extent of " + extent);
    }
}
