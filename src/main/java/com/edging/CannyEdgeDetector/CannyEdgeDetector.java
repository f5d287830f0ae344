package com.edging.CannyEdgeDetector;

import com.edging.exception.ShapeMismatchException;
import com.edging.filter_convolution.BorderType;
import com.edging.filter_convolution.Kernels;
import com.edging.filter_convolution.LinearFiltering;
import com.edging.gradient.GradientField;
import com.edging.gradient.SobelGradient;
import com.edging.imageOperator.ColourImageToGray;
import com.edging.imageOperator.Dense2DArray;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canny edge detector composed of the individual stages:
 * <ol>
 *     <li>RGB to gray (3-channel input only)</li>
 *     <li>5x5 Gaussian smoothing</li>
 *     <li>Sobel gradient magnitude and direction</li>
 *     <li>non-maximum suppression</li>
 *     <li>hysteresis with thresholds {@code ratio * max gradient magnitude}</li>
 * </ol>
 * Stateless between calls: the same input always yields the same edge map.
 */
@Getter
public class CannyEdgeDetector {
    private static final Logger logger = LoggerFactory.getLogger(CannyEdgeDetector.class);

    private final double highThresholdRatio;
    private final double lowThresholdRatio;
    private final BorderType border;

    /**
     * @param highThresholdRatio fraction of the strongest gradient above which a pixel is a strong edge
     * @param lowThresholdRatio  fraction of the strongest gradient below which a pixel is discarded
     * @throws com.edging.exception.InvalidThresholdException unless {@code 0 <= low < high}
     */
    public CannyEdgeDetector(double highThresholdRatio, double lowThresholdRatio, BorderType border) {
        HysteresisThresholding.validateThresholds(lowThresholdRatio, highThresholdRatio);
        this.highThresholdRatio = highThresholdRatio;
        this.lowThresholdRatio = lowThresholdRatio;
        this.border = border;
    }

    public static EdgeMap cannyEdge(Dense2DArray image, double highThresholdRatio, double lowThresholdRatio,
                                    BorderType border) {
        return new CannyEdgeDetector(highThresholdRatio, lowThresholdRatio, border).detect(image);
    }

    public EdgeMap detect(Dense2DArray image) {
        Dense2DArray gray = toSingleChannel(image);

        // Giai đoạn 1: làm mịn và tính gradient
        Dense2DArray smoothed = LinearFiltering.convolve(gray, Kernels.cannySmoothing(), border);
        GradientField field = SobelGradient.gradient(smoothed, border);

        // Giai đoạn 2: Non-Maximum Suppression
        Dense2DArray thinned = NonMaximumSuppression.suppress(field);

        // Giai đoạn 3: ngưỡng kép
        double maxMagnitude = field.maxMagnitude();
        if (!(maxMagnitude > 0)) {
            logger.debug("No gradient in {}, returning an empty edge map", image);
            return EdgeMap.empty(gray.getRows(), gray.getCols());
        }
        double high = highThresholdRatio * maxMagnitude;
        double low = lowThresholdRatio * maxMagnitude;
        logger.debug("Canny on {}: max magnitude {}, thresholds [{}, {}]", image, maxMagnitude, low, high);
        return HysteresisThresholding.hysteresis(thinned, low, high);
    }

    private static Dense2DArray toSingleChannel(Dense2DArray image) {
        switch (image.getChannels()) {
            case 1:
                return image;
            case 3:
                return ColourImageToGray.toGray(image);
            default:
                throw new ShapeMismatchException("Canny needs 1 or 3 channels, got " + image.getChannels());
        }
    }
}
