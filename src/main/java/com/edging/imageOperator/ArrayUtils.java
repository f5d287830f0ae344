package com.edging.imageOperator;

import com.edging.exception.ShapeMismatchException;

public final class ArrayUtils {

    private ArrayUtils() {
    }

    /**
     * Largest absolute sample difference between two arrays of the same shape.
     */
    public static double maxDiff(Dense2DArray a, Dense2DArray b) {
        if (!a.sameShape(b)) {
            throw new ShapeMismatchException("Cannot compare " + a + " with " + b);
        }
        double[] x = a.getData();
        double[] y = b.getData();
        double max = 0;
        for (int i = 0; i < x.length; i++) {
            max = Math.max(max, Math.abs(x[i] - y[i]));
        }
        return max;
    }

    /**
     * Maps a [0,1] sample to a byte level, rounding half up and clamping to [0,255].
     */
    public static int toByte(double v) {
        int level = (int) (v * 255.0 + 0.5);
        return Math.max(0, Math.min(255, level));
    }
}
