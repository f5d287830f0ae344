package com.edging.exception;

public class PixelIndexOutOfBoundsException extends EdgeDetectionException {

    public PixelIndexOutOfBoundsException(int row, int col, int channel, int rows, int cols, int channels) {
        super(ErrorKind.INDEX_OUT_OF_BOUNDS,
                String.format("Sample (%d, %d, %d) is outside [0,%d) x [0,%d) x [0,%d)",
                        row, col, channel, rows, cols, channels));
    }
}
