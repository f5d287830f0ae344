package com.edging.CannyEdgeDetector;

import com.edging.exception.ShapeMismatchException;
import com.edging.imageOperator.Dense2DArray;

/**
 * Terminal artifact of the pipeline: a 1-channel array holding 1 on edges and 0 elsewhere.
 */
public final class EdgeMap {
    public static final double EDGE = 1.0;
    public static final double NON_EDGE = 0.0;

    private final Dense2DArray array;

    EdgeMap(Dense2DArray array) {
        if (array.getChannels() != 1) {
            throw new ShapeMismatchException("Edge map must be 1-channel, got " + array.getChannels());
        }
        this.array = array;
    }

    static EdgeMap empty(int rows, int cols) {
        return new EdgeMap(Dense2DArray.zeros(rows, cols, 1));
    }

    /**
     * @return a copy of the 0/1 array; writes to it do not reach this map
     */
    public Dense2DArray getArray() {
        return array.copy();
    }

    public int getRows() {
        return array.getRows();
    }

    public int getCols() {
        return array.getCols();
    }

    public boolean isEdge(int row, int col) {
        return array.get(row, col) == EDGE;
    }

    public int edgeCount() {
        int count = 0;
        for (double v : array.getData()) {
            if (v == EDGE) count++;
        }
        return count;
    }
}
