package com.edging.filter_convolution;

import com.edging.imageOperator.Dense2DArray;

/**
 * Blur filters built on {@link LinearFiltering}. Multi-channel arrays are smoothed per channel.
 */
public final class Smoothing {

    private Smoothing() {
    }

    /**
     * Gaussian blur with sigma = 1 over a {@code ksize x ksize} footprint.
     */
    public static Dense2DArray gaussian(Dense2DArray image, int ksize, BorderType border) {
        return LinearFiltering.convolve(image, Kernels.gaussian(ksize), border);
    }

    public static Dense2DArray gaussian(Dense2DArray image, int ksize, double sigma, BorderType border) {
        return LinearFiltering.convolve(image, Kernels.gaussian(ksize, sigma), border);
    }

    public static Dense2DArray mean(Dense2DArray image, int ksize, BorderType border) {
        return LinearFiltering.convolve(image, Kernels.box(ksize), border);
    }
}
