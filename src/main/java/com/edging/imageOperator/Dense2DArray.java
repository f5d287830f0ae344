package com.edging.imageOperator;

import com.edging.exception.PixelIndexOutOfBoundsException;
import com.edging.exception.ShapeMismatchException;
import lombok.Getter;

import java.util.Arrays;

/**
 * Dense image buffer of {@code double} samples, rows x cols x channels, row-major.
 * Sample (r, c, ch) lives at {@code (r * cols + c) * channels + ch}.
 * <p>
 * The value domain is not enforced: callers normalise to [0,1] or [0,255] themselves.
 */
@Getter
public final class Dense2DArray {
    // Luôn là format [height][width]: rows là chiều cao, cols là chiều rộng
    private final int rows;
    private final int cols;
    private final int channels;
    private final double[] data;

    private Dense2DArray(int rows, int cols, int channels, double[] data) {
        this.rows = rows;
        this.cols = cols;
        this.channels = channels;
        this.data = data;
    }

    public static Dense2DArray filled(int rows, int cols, int channels, double value) {
        double[] data = new double[sampleCount(rows, cols, channels)];
        Arrays.fill(data, value);
        return new Dense2DArray(rows, cols, channels, data);
    }

    public static Dense2DArray zeros(int rows, int cols, int channels) {
        return filled(rows, cols, channels, 0.0);
    }

    /**
     * Wraps {@code data} without copying it.
     *
     * @throws ShapeMismatchException if {@code data.length != rows * cols * channels}
     */
    public static Dense2DArray of(int rows, int cols, int channels, double[] data) {
        int length = sampleCount(rows, cols, channels);
        if (data == null || data.length != length) {
            throw new ShapeMismatchException("Buffer of length " + (data == null ? "null" : data.length)
                    + " does not match " + rows + "x" + cols + "x" + channels);
        }
        return new Dense2DArray(rows, cols, channels, data);
    }

    /**
     * Builds a 1-channel array from a {@code [height][width]} matrix.
     */
    public static Dense2DArray fromMatrix(double[][] matrix) {
        if (matrix == null || matrix.length == 0 || matrix[0] == null || matrix[0].length == 0) {
            throw new ShapeMismatchException("Matrix must have at least one row and one column");
        }
        int rows = matrix.length;
        int cols = matrix[0].length;
        double[] data = new double[rows * cols];
        for (int y = 0; y < rows; y++) {
            if (matrix[y] == null || matrix[y].length != cols) {
                throw new ShapeMismatchException("Row " + y + " does not have " + cols + " columns");
            }
            System.arraycopy(matrix[y], 0, data, y * cols, cols);
        }
        return new Dense2DArray(rows, cols, 1, data);
    }

    /**
     * @return {@code rows * cols * channels}
     * @throws ShapeMismatchException if an extent is not positive or the product does not fit in an int
     */
    private static int sampleCount(int rows, int cols, int channels) {
        if (rows < 1 || cols < 1 || channels < 1) {
            throw new ShapeMismatchException("Extents must be positive, got " + rows + "x" + cols + "x" + channels);
        }
        long pixels = (long) rows * cols;
        long count = pixels * channels;
        if (pixels > Integer.MAX_VALUE || count > Integer.MAX_VALUE) {
            throw new ShapeMismatchException(rows + "x" + cols + "x" + channels + " does not fit in one buffer");
        }
        return (int) count;
    }

    public double get(int row, int col) {
        return get(row, col, 0);
    }

    public double get(int row, int col, int channel) {
        return data[offset(row, col, channel)];
    }

    public void set(int row, int col, double value) {
        set(row, col, 0, value);
    }

    public void set(int row, int col, int channel, double value) {
        data[offset(row, col, channel)] = value;
    }

    private int offset(int row, int col, int channel) {
        if (row < 0 || row >= rows || col < 0 || col >= cols || channel < 0 || channel >= channels) {
            throw new PixelIndexOutOfBoundsException(row, col, channel, rows, cols, channels);
        }
        return (row * cols + col) * channels + channel;
    }

    public int size() {
        return data.length;
    }

    public boolean sameShape(Dense2DArray other) {
        return rows == other.rows && cols == other.cols && channels == other.channels;
    }

    public Dense2DArray copy() {
        return new Dense2DArray(rows, cols, channels, data.clone());
    }

    /**
     * Extracts one channel as a 1-channel array.
     */
    public Dense2DArray channel(int channel) {
        if (channel < 0 || channel >= channels) {
            throw new PixelIndexOutOfBoundsException(0, 0, channel, rows, cols, channels);
        }
        if (channels == 1) {
            return copy();
        }
        double[] out = new double[rows * cols];
        for (int p = 0; p < out.length; p++) {
            out[p] = data[p * channels + channel];
        }
        return new Dense2DArray(rows, cols, 1, out);
    }

    public double[][] toMatrix() {
        if (channels != 1) {
            throw new ShapeMismatchException("toMatrix needs a 1-channel array, got " + channels + " channels");
        }
        double[][] matrix = new double[rows][cols];
        for (int y = 0; y < rows; y++) {
            System.arraycopy(data, y * cols, matrix[y], 0, cols);
        }
        return matrix;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            if (v > max) max = v;
        }
        return max;
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : data) {
            if (v < min) min = v;
        }
        return min;
    }

    @Override
    public String toString() {
        return "Dense2DArray{" + rows + "x" + cols + "x" + channels + "}";
    }
}
