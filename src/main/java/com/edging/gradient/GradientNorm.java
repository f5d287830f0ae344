package com.edging.gradient;

public enum GradientNorm {
    /** |gx| + |gy| */
    L1,
    /** sqrt(gx^2 + gy^2) */
    L2,
    /** max(|gx|, |gy|) */
    INF;

    public double apply(double gx, double gy) {
        switch (this) {
            case L1:
                return Math.abs(gx) + Math.abs(gy);
            case L2:
                return Math.sqrt(gx * gx + gy * gy);
            case INF:
                return Math.max(Math.abs(gx), Math.abs(gy));
            default:
                throw new IllegalStateException("Unknown norm " + this);
        }
    }
}
