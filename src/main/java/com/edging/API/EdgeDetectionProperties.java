package com.edging.API;

import com.edging.filter_convolution.BorderType;
import com.edging.gradient.GradientNorm;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults used when a request leaves a parameter out.
 */
@Data
@ConfigurationProperties(prefix = "edge.canny")
public class EdgeDetectionProperties {

    /** Strong-edge threshold as a fraction of the largest gradient magnitude */
    private double highThresholdRatio = 0.3;

    /** Weak-edge threshold as a fraction of the largest gradient magnitude */
    private double lowThresholdRatio = 0.1;

    private BorderType border = BorderType.REFLECT;

    /** Gaussian kernel size for /smooth (odd) */
    private int smoothingKernelSize = 5;

    private GradientNorm gradientNorm = GradientNorm.L2;

    /** Largest rows * cols * channels accepted per request */
    private int maxPixels = 12_582_912;
}
