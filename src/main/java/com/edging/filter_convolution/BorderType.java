package com.edging.filter_convolution;

import com.edging.exception.KernelTooLargeException;

/**
 * How samples requested outside the array are resolved. Applied to rows and columns independently.
 * <pre>
 * ZERO       0000|abcdefgh|0000
 * REPLICATE  aaaa|abcdefgh|hhhh
 * REFLECT    dcba|abcdefgh|hgfe
 * </pre>
 */
public enum BorderType {
    ZERO,
    REPLICATE,
    REFLECT;

    /** Returned by {@link #resolve} when the sample must be read as 0. */
    public static final int ZERO_FILL = -1;

    /**
     * @param index  requested index, possibly out of range
     * @param extent number of valid indices along the axis
     * @return an index in [0, extent) or {@link #ZERO_FILL}
     * @throws KernelTooLargeException for {@code REFLECT} when one reflection is not enough
     */
    public int resolve(int index, int extent) {
        if (index >= 0 && index < extent) {
            return index;
        }
        switch (this) {
            case ZERO:
                return ZERO_FILL;
            case REPLICATE:
                return index < 0 ? 0 : extent - 1;
            case REFLECT:
                int reflected = index < 0 ? -index - 1 : 2 * extent - index - 1;
                if (reflected < 0 || reflected >= extent) {
                    throw new KernelTooLargeException(index, extent);
                }
                return reflected;
            default:
                throw new IllegalStateException("Unknown border type " + this);
        }
    }
}
