package com.edging.gradient;

import com.edging.imageOperator.Dense2DArray;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Derivatives of one source array together with the magnitude and direction derived from them.
 * All four arrays share the source shape. Direction is in radians, range (-pi, pi], and only
 * meaningful where magnitude > 0.
 */
@AllArgsConstructor
@Getter
public class GradientField {
    private final Dense2DArray gx;
    private final Dense2DArray gy;
    private final Dense2DArray magnitude;
    private final Dense2DArray direction;

    public int getRows() {
        return magnitude.getRows();
    }

    public int getCols() {
        return magnitude.getCols();
    }

    public double maxMagnitude() {
        return magnitude.max();
    }
}
