package com.edging.API;

/**
 * JSON body shared by the filtering endpoints. {@code data} is row-major, channels interleaved.
 * Every field except rows, cols and data is optional.
 */
public class ArrayRequest {
    public Integer rows;
    public Integer cols;
    public Integer channels;
    public double[] data;

    public String border;
    public Double highRatio;
    public Double lowRatio;
    public Integer kernelSize;
    public String norm;
}
