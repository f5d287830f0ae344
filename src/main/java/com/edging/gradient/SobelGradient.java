package com.edging.gradient;

import com.edging.exception.ShapeMismatchException;
import com.edging.filter_convolution.BorderType;
import com.edging.filter_convolution.Kernels;
import com.edging.filter_convolution.LinearFiltering;
import com.edging.imageOperator.Dense2DArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-order derivatives with the 3x3 Sobel pair.
 * Rows grow downward, so a positive gy points towards the next row.
 */
public class SobelGradient {
    private static final Logger logger = LoggerFactory.getLogger(SobelGradient.class);

    private SobelGradient() {
    }

    /**
     * @param grayImage 1-channel source
     * @return gx, gy, magnitude {@code sqrt(gx^2 + gy^2)} and direction {@code atan2(gy, gx)} in (-pi, pi]
     * @throws ShapeMismatchException if the source is not 1-channel
     */
    public static GradientField gradient(Dense2DArray grayImage, BorderType border) {
        requireSingleChannel(grayImage);
        Dense2DArray gx = LinearFiltering.convolve(grayImage, Kernels.sobelX(), border);
        Dense2DArray gy = LinearFiltering.convolve(grayImage, Kernels.sobelY(), border);

        double[] x = gx.getData();
        double[] y = gy.getData();
        double[] magnitude = new double[x.length];
        double[] orientation = new double[x.length]; // radian

        for (int p = 0; p < x.length; p++) {
            magnitude[p] = Math.sqrt(x[p] * x[p] + y[p] * y[p]);
            orientation[p] = normalizeAngle(Math.atan2(y[p], x[p]));
        }

        int rows = grayImage.getRows();
        int cols = grayImage.getCols();
        GradientField field = new GradientField(gx, gy,
                Dense2DArray.of(rows, cols, 1, magnitude),
                Dense2DArray.of(rows, cols, 1, orientation));
        logger.debug("Sobel gradient of {}: max magnitude {}", grayImage, field.maxMagnitude());
        return field;
    }

    /**
     * Norm of the Sobel derivatives, usable directly as an edge-strength image.
     */
    public static Dense2DArray norm(Dense2DArray grayImage, GradientNorm norm, BorderType border) {
        requireSingleChannel(grayImage);
        double[] x = LinearFiltering.convolve(grayImage, Kernels.sobelX(), border).getData();
        double[] y = LinearFiltering.convolve(grayImage, Kernels.sobelY(), border).getData();
        double[] out = new double[x.length];
        for (int p = 0; p < x.length; p++) {
            out[p] = norm.apply(x[p], y[p]);
        }
        return Dense2DArray.of(grayImage.getRows(), grayImage.getCols(), 1, out);
    }

    // atan2 yields -pi for (-0.0, negative); fold it onto pi, and -0.0 onto 0.0
    static double normalizeAngle(double angle) {
        if (angle == -Math.PI) {
            return Math.PI;
        }
        return angle + 0.0;
    }

    private static void requireSingleChannel(Dense2DArray image) {
        if (image.getChannels() != 1) {
            throw new ShapeMismatchException("Gradient needs a 1-channel array, got " + image.getChannels() + " channels");
        }
    }
}
