package com.edging.API;

import com.edging.CannyEdgeDetector.CannyEdgeDetector;
import com.edging.CannyEdgeDetector.EdgeMap;
import com.edging.filter_convolution.BorderType;
import com.edging.filter_convolution.Smoothing;
import com.edging.gradient.GradientNorm;
import com.edging.gradient.SobelGradient;
import com.edging.imageOperator.ColourImageToGray;
import com.edging.imageOperator.Dense2DArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the filtering stages with request parameters, falling back to {@link EdgeDetectionProperties}.
 * Errors from the stages propagate unchanged.
 */
@Service
public class EdgeDetectionService {
    private static final Logger logger = LoggerFactory.getLogger(EdgeDetectionService.class);

    private final EdgeDetectionProperties properties;

    public EdgeDetectionService(EdgeDetectionProperties properties) {
        this.properties = properties;
    }

    public EdgeMap canny(Dense2DArray image, Double highRatio, Double lowRatio, BorderType border) {
        double high = highRatio != null ? highRatio : properties.getHighThresholdRatio();
        double low = lowRatio != null ? lowRatio : properties.getLowThresholdRatio();
        BorderType b = border != null ? border : properties.getBorder();

        long start = System.currentTimeMillis();
        EdgeMap edges = CannyEdgeDetector.cannyEdge(image, high, low, b);
        logger.info("Canny on {} (high={}, low={}, border={}): {} edge pixels in {} ms",
                image, high, low, b, edges.edgeCount(), System.currentTimeMillis() - start);
        return edges;
    }

    public Dense2DArray smooth(Dense2DArray image, Integer kernelSize, BorderType border) {
        int ksize = kernelSize != null ? kernelSize : properties.getSmoothingKernelSize();
        BorderType b = border != null ? border : properties.getBorder();
        logger.info("Gaussian smoothing of {} with ksize={}, border={}", image, ksize, b);
        return Smoothing.gaussian(image, ksize, b);
    }

    public Dense2DArray sobelNorm(Dense2DArray image, GradientNorm norm, BorderType border) {
        GradientNorm n = norm != null ? norm : properties.getGradientNorm();
        BorderType b = border != null ? border : properties.getBorder();
        Dense2DArray gray = image.getChannels() == 3 ? ColourImageToGray.toGray(image) : image;
        logger.info("Sobel {} norm of {}, border={}", n, image, b);
        return SobelGradient.norm(gray, n, b);
    }

    public Dense2DArray gray(Dense2DArray image) {
        logger.info("Grayscale conversion of {}", image);
        return ColourImageToGray.toGray(image);
    }

    /**
     * Counts samples, so a 3-channel array uses three times the budget of a gray one.
     */
    public boolean exceedsPixelLimit(int rows, int cols, int channels) {
        long pixels = (long) rows * cols;
        if (pixels > properties.getMaxPixels()) {
            return true;
        }
        return pixels * channels > properties.getMaxPixels();
    }
}
