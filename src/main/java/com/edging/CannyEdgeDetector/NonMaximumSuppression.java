package com.edging.CannyEdgeDetector;

import com.edging.gradient.GradientField;
import com.edging.imageOperator.Dense2DArray;

import java.util.stream.IntStream;

/**
 * Thins gradient ridges to one pixel by keeping only local maxima along the gradient direction.
 * <p>
 * The direction is quantised to the nearest of 0, 45, 90 and 135 degrees (modulo 180) and the
 * magnitude is compared with the two discrete neighbours on that axis; no interpolation is done.
 * A pixel survives when it is {@code >=} the neighbour behind it and strictly {@code >} the one
 * ahead of it, so a plateau two pixels wide keeps exactly one of them.
 * <p>
 * The one-pixel frame is always 0: suppression needs a full neighbourhood.
 */
public class NonMaximumSuppression {

    private NonMaximumSuppression() {
    }

    public static Dense2DArray suppress(GradientField field) {
        int height = field.getRows();
        int width = field.getCols();
        double[] magnitude = field.getMagnitude().getData();
        double[] orientation = field.getDirection().getData();
        double[] suppressedMag = new double[magnitude.length];

        // Duyệt qua các pixel bên trong ảnh (bỏ qua đường viền 1 pixel)
        IntStream.range(1, height - 1).parallel().forEach(y -> {
            for (int x = 1; x < width - 1; x++) {
                int p = y * width + x;
                double mag = magnitude[p];
                int[] step = axisStep(orientation[p]);
                int ahead = p + step[0] * width + step[1];
                int behind = p - step[0] * width - step[1];

                if (mag >= magnitude[behind] && mag > magnitude[ahead]) {
                    suppressedMag[p] = mag;
                }
            }
        });
        return Dense2DArray.of(height, width, 1, suppressedMag);
    }

    /**
     * (row step, col step) pointing along the quantised gradient axis.
     */
    static int[] axisStep(double angle) {
        double angleDegrees = angle * 180.0 / Math.PI;
        if (angleDegrees < 0) {
            angleDegrees += 180;
        }

        if (22.5 <= angleDegrees && angleDegrees < 67.5) {
            return new int[]{1, 1};
        } else if (67.5 <= angleDegrees && angleDegrees < 112.5) {
            return new int[]{1, 0};
        } else if (112.5 <= angleDegrees && angleDegrees < 157.5) {
            return new int[]{1, -1};
        }
        // [0, 22.5) and [157.5, 180]
        return new int[]{0, 1};
    }
}
