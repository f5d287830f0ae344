package com.edging.filter_convolution;

import com.edging.exception.ShapeMismatchException;

/**
 * Factory of the standard kernels used by the smoothing and gradient stages.
 */
public final class Kernels {

    private static final double[][] CANNY_SMOOTHING = {
            {2, 4, 5, 4, 2},
            {4, 9, 12, 9, 4},
            {5, 12, 15, 12, 5},
            {4, 9, 12, 9, 4},
            {2, 4, 5, 4, 2}
    };

    private static final double[][] SOBEL_X = {
            {-1, 0, 1},
            {-2, 0, 2},
            {-1, 0, 1}
    };

    private Kernels() {
    }

    /**
     * 5x5 Gaussian approximation (weights / 159) applied before the Canny gradient.
     */
    public static Kernel cannySmoothing() {
        return Kernel.of(CANNY_SMOOTHING).scale(1.0 / 159.0);
    }

    public static Kernel sobelX() {
        return Kernel.of(SOBEL_X);
    }

    public static Kernel sobelY() {
        return Kernel.of(SOBEL_X).transpose();
    }

    /**
     * Square Gaussian with sigma = 1: {@code exp(-d^2 / 2)} normalised to sum 1.
     */
    public static Kernel gaussian(int size) {
        return gaussian(size, 1.0);
    }

    public static Kernel gaussian(int size, double sigma) {
        checkSize(size);
        if (!(sigma > 0)) {
            throw new ShapeMismatchException("Sigma must be positive, got " + sigma);
        }
        int center = size / 2;
        double[][] kernel = new double[size][size];
        double sum = 0;
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int dy = y - center;
                int dx = x - center;
                kernel[y][x] = Math.exp(-(dx * dx + dy * dy) / (2 * sigma * sigma));
                sum += kernel[y][x];
            }
        }
        // Chuẩn hóa để tổng bằng 1
        for (int y = 0; y < size; y++)
            for (int x = 0; x < size; x++)
                kernel[y][x] /= sum;
        return Kernel.of(kernel);
    }

    /**
     * Mean filter: every weight is 1 / (size * size).
     */
    public static Kernel box(int size) {
        checkSize(size);
        double val = 1.0 / (size * size);
        double[][] kernel = new double[size][size];
        for (int i = 0; i < size; i++)
            for (int j = 0; j < size; j++)
                kernel[i][j] = val;
        return Kernel.of(kernel);
    }

    private static void checkSize(int size) {
        if (size < 1 || size % 2 == 0) {
            throw new ShapeMismatchException("Kernel size must be a positive odd number, got " + size);
        }
    }
}
