package com.edging.filter_convolution;

import com.edging.imageOperator.Dense2DArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * Convolution engine.
 * <p>
 * The kernel is applied as a <b>correlation</b>: it is not flipped, so output(y, x) is
 * {@code sum(kernel[ky][kx] * src[y + ky - ry][x + kx - rx])}. Symmetric kernels (Gaussian, box)
 * are unaffected; antisymmetric ones such as Sobel give the sign that matches the axis direction.
 * Callers that need a true convolution pass {@link Kernel#flip()}.
 * <p>
 * Multi-channel arrays are filtered per channel. Output rows are independent and are computed
 * in parallel; the result does not depend on the scheduling.
 */
public class LinearFiltering {
    private static final Logger logger = LoggerFactory.getLogger(LinearFiltering.class);

    private LinearFiltering() {
    }

    /**
     * @throws com.edging.exception.ShapeMismatchException if {@code weights} has an even dimension
     */
    public static Dense2DArray convolve(Dense2DArray image, double[][] weights, BorderType border) {
        return convolve(image, Kernel.of(weights), border);
    }

    /**
     * @return a new array with the shape of {@code image}
     * @throws com.edging.exception.KernelTooLargeException if {@code REFLECT} cannot cover the kernel radius
     */
    public static Dense2DArray convolve(Dense2DArray image, Kernel kernel, BorderType border) {
        int height = image.getRows();
        int width = image.getCols();
        int channels = image.getChannels();
        int kernelHeight = kernel.getRows();
        int kernelWidth = kernel.getCols();
        int kernelCenterY = kernel.getRadiusRows();
        int kernelCenterX = kernel.getRadiusCols();

        logger.debug("Convolving {} with {}x{} kernel, border={}", image, kernelHeight, kernelWidth, border);

        // Border indices resolved once per call: lookup[i + radius] is the source index of i
        int[] rowLookup = borderLookup(height, kernelCenterY, border);
        int[] colLookup = borderLookup(width, kernelCenterX, border);

        double[] src = image.getData();
        double[] out = new double[src.length];

        IntStream.range(0, height).parallel().forEach(y -> {
            for (int x = 0; x < width; x++) {
                for (int ch = 0; ch < channels; ch++) {
                    double sum = 0;
                    for (int ky = 0; ky < kernelHeight; ky++) {
                        int pixelY = rowLookup[y + ky];
                        if (pixelY == BorderType.ZERO_FILL) continue;
                        int rowOffset = pixelY * width;
                        for (int kx = 0; kx < kernelWidth; kx++) {
                            int pixelX = colLookup[x + kx];
                            if (pixelX == BorderType.ZERO_FILL) continue;
                            sum += src[(rowOffset + pixelX) * channels + ch] * kernel.weight(ky, kx);
                        }
                    }
                    out[(y * width + x) * channels + ch] = sum;
                }
            }
        });
        return Dense2DArray.of(height, width, channels, out);
    }

    private static int[] borderLookup(int extent, int radius, BorderType border) {
        int[] lookup = new int[extent + 2 * radius];
        for (int i = 0; i < lookup.length; i++) {
            lookup[i] = border.resolve(i - radius, extent);
        }
        return lookup;
    }
}
