package com.edging.imageOperator;

import com.edging.exception.ShapeMismatchException;

public class ColourImageToGray {

    public static final double RED_WEIGHT = 0.299;
    public static final double GREEN_WEIGHT = 0.587;
    public static final double BLUE_WEIGHT = 0.114;

    private ColourImageToGray() {
    }

    /**
     * Reduces an RGB array to one luminance channel: 0.299 R + 0.587 G + 0.114 B.
     *
     * @param image 3-channel array, channels ordered R, G, B
     * @return a new 1-channel array of the same rows and cols
     * @throws ShapeMismatchException unless {@code image} has exactly 3 channels
     */
    public static Dense2DArray toGray(Dense2DArray image) {
        if (image.getChannels() != 3) {
            throw new ShapeMismatchException("Grayscale conversion needs 3 channels, got " + image.getChannels());
        }
        double[] rgb = image.getData();
        double[] gray = new double[image.getRows() * image.getCols()];
        for (int p = 0; p < gray.length; p++) {
            int i = p * 3;
            gray[p] = RED_WEIGHT * rgb[i] + GREEN_WEIGHT * rgb[i + 1] + BLUE_WEIGHT * rgb[i + 2];
        }
        return Dense2DArray.of(image.getRows(), image.getCols(), 1, gray);
    }
}
