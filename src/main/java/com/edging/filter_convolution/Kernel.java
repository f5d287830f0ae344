package com.edging.filter_convolution;

import com.edging.exception.ShapeMismatchException;
import lombok.Getter;

/**
 * Immutable correlation weights with odd rows and odd cols, centred at (rows/2, cols/2).
 */
public final class Kernel {
    @Getter
    private final int rows;
    @Getter
    private final int cols;
    private final double[] weights;

    private Kernel(int rows, int cols, double[] weights) {
        this.rows = rows;
        this.cols = cols;
        this.weights = weights;
    }

    public static Kernel of(double[][] weights) {
        if (weights == null || weights.length == 0 || weights[0] == null || weights[0].length == 0) {
            throw new ShapeMismatchException("Kernel must have at least one weight");
        }
        int rows = weights.length;
        int cols = weights[0].length;
        if (rows % 2 == 0 || cols % 2 == 0) {
            throw new ShapeMismatchException("Kernel dimensions must be odd, got " + rows + "x" + cols);
        }
        double[] flat = new double[rows * cols];
        for (int y = 0; y < rows; y++) {
            if (weights[y] == null || weights[y].length != cols) {
                throw new ShapeMismatchException("Kernel row " + y + " does not have " + cols + " columns");
            }
            System.arraycopy(weights[y], 0, flat, y * cols, cols);
        }
        return new Kernel(rows, cols, flat);
    }

    public int getRadiusRows() {
        return rows / 2;
    }

    public int getRadiusCols() {
        return cols / 2;
    }

    public double weight(int row, int col) {
        return weights[row * cols + col];
    }

    public double sum() {
        double sum = 0;
        for (double w : weights) sum += w;
        return sum;
    }

    public Kernel scale(double factor) {
        double[] scaled = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            scaled[i] = weights[i] * factor;
        }
        return new Kernel(rows, cols, scaled);
    }

    public Kernel transpose() {
        double[] t = new double[weights.length];
        for (int y = 0; y < rows; y++)
            for (int x = 0; x < cols; x++)
                t[x * rows + y] = weights[y * cols + x];
        return new Kernel(cols, rows, t);
    }

    /**
     * Rotates the weights by 180 degrees. Correlating with the flipped kernel is a true convolution.
     */
    public Kernel flip() {
        double[] f = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            f[weights.length - 1 - i] = weights[i];
        }
        return new Kernel(rows, cols, f);
    }

    public double[][] toMatrix() {
        double[][] m = new double[rows][cols];
        for (int y = 0; y < rows; y++) {
            System.arraycopy(weights, y * cols, m[y], 0, cols);
        }
        return m;
    }
}
