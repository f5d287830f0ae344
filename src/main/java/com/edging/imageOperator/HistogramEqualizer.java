package com.edging.imageOperator;

import com.edging.exception.ShapeMismatchException;

/**
 * Histogram equalisation of a 1-channel image normalised to [0,1].
 * Samples are binned into 256 byte levels; each output sample is the cumulative
 * fraction of pixels at or below its level.
 */
public final class HistogramEqualizer {

    private static final int LEVELS = 256;

    private HistogramEqualizer() {
    }

    public static Dense2DArray equalize(Dense2DArray gray) {
        if (gray.getChannels() != 1) {
            throw new ShapeMismatchException("Histogram equalisation needs 1 channel, got " + gray.getChannels());
        }
        double[] in = gray.getData();
        double[] cdf = new double[LEVELS];
        for (double v : in) {
            cdf[ArrayUtils.toByte(v)] += 1.0;
        }
        for (int i = 1; i < LEVELS; i++) {
            cdf[i] += cdf[i - 1];
        }
        double total = cdf[LEVELS - 1];
        double[] out = new double[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = cdf[ArrayUtils.toByte(in[i])] / total;
        }
        return Dense2DArray.of(gray.getRows(), gray.getCols(), 1, out);
    }
}
