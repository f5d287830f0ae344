package com.edging.CannyEdgeDetector;

import com.edging.exception.InvalidThresholdException;
import com.edging.exception.ShapeMismatchException;
import com.edging.filter_convolution.BorderType;
import com.edging.imageOperator.Dense2DArray;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class CannyEdgeDetectorTest {

    private static Dense2DArray verticalStep(int rows, int cols, int stepCol, int channels) {
        Dense2DArray a = Dense2DArray.zeros(rows, cols, channels);
        for (int y = 0; y < rows; y++)
            for (int x = stepCol; x < cols; x++)
                for (int c = 0; c < channels; c++)
                    a.set(y, x, c, 100.0);
        return a;
    }

    private static int edgeColumn(EdgeMap edges, int row) {
        int found = -1;
        for (int x = 0; x < edges.getCols(); x++) {
            if (edges.isEdge(row, x)) {
                assertEquals(-1, found, "more than one edge pixel in row " + row);
                found = x;
            }
        }
        return found;
    }

    @Test
    public void testStepEdgeGivesOnePixelWideColumn() {
        EdgeMap edges = CannyEdgeDetector.cannyEdge(verticalStep(5, 5, 2, 1), 0.5, 0.2, BorderType.REFLECT);

        assertEquals(3, edges.edgeCount());
        int column = edgeColumn(edges, 1);
        assertTrue(column == 1 || column == 2, "edge sits next to the step, got column " + column);
        for (int y = 1; y <= 3; y++) {
            assertEquals(column, edgeColumn(edges, y));
        }
        for (int x = 0; x < 5; x++) {
            assertFalse(edges.isEdge(0, x));
            assertFalse(edges.isEdge(4, x));
        }
        for (double v : edges.getArray().getData()) {
            assertTrue(v == 0.0 || v == 1.0);
        }
    }

    @Test
    public void testLargerStepIsThinEveryRow() {
        EdgeMap edges = CannyEdgeDetector.cannyEdge(verticalStep(20, 20, 10, 1), 0.5, 0.2, BorderType.REFLECT);
        int column = edgeColumn(edges, 1);
        assertTrue(column == 9 || column == 10, "got column " + column);
        for (int y = 1; y < 19; y++) {
            assertEquals(column, edgeColumn(edges, y));
        }
        assertEquals(18, edges.edgeCount());
    }

    @Test
    public void testColourInputIsConvertedToGray() {
        EdgeMap edges = CannyEdgeDetector.cannyEdge(verticalStep(5, 5, 2, 3), 0.5, 0.2, BorderType.REFLECT);
        assertEquals(1, edges.getArray().getChannels());
        assertEquals(3, edges.edgeCount());
    }

    @Test
    public void testConstantImageHasNoEdges() {
        EdgeMap edges = CannyEdgeDetector.cannyEdge(Dense2DArray.filled(8, 8, 1, 77.0), 0.5, 0.2, BorderType.REPLICATE);
        assertEquals(0, edges.edgeCount());
        assertEquals(8, edges.getRows());
    }

    @Test
    public void testSquareOutline() {
        Dense2DArray square = Dense2DArray.zeros(16, 16, 1);
        for (int y = 5; y < 11; y++)
            for (int x = 5; x < 11; x++)
                square.set(y, x, 200.0);

        EdgeMap edges = CannyEdgeDetector.cannyEdge(square, 0.4, 0.1, BorderType.REPLICATE);
        assertTrue(edges.edgeCount() > 0);
        assertFalse(edges.isEdge(7, 7), "inside of the square is flat");
        assertFalse(edges.isEdge(8, 8), "inside of the square is flat");
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                if (y < 2 || y > 13 || x < 2 || x > 13) {
                    assertFalse(edges.isEdge(y, x), "far from the square at " + y + "," + x);
                }
            }
        }
    }

    @Test
    public void testDeterministic() {
        Random random = new Random(2024);
        double[] data = new double[32 * 32];
        for (int i = 0; i < data.length; i++) {
            data[i] = random.nextDouble() * 255;
        }
        Dense2DArray image = Dense2DArray.of(32, 32, 1, data);

        EdgeMap first = CannyEdgeDetector.cannyEdge(image, 0.3, 0.1, BorderType.REFLECT);
        EdgeMap second = CannyEdgeDetector.cannyEdge(image, 0.3, 0.1, BorderType.REFLECT);
        assertArrayEquals(first.getArray().getData(), second.getArray().getData());
    }

    @Test
    public void testErrorsPropagate() {
        Dense2DArray image = verticalStep(5, 5, 2, 1);
        assertThrows(InvalidThresholdException.class,
                () -> CannyEdgeDetector.cannyEdge(image, 0.2, 0.5, BorderType.REFLECT));
        assertThrows(InvalidThresholdException.class,
                () -> CannyEdgeDetector.cannyEdge(image, 0.5, -0.1, BorderType.REFLECT));
        assertThrows(ShapeMismatchException.class,
                () -> CannyEdgeDetector.cannyEdge(Dense2DArray.zeros(5, 5, 2), 0.5, 0.2, BorderType.REFLECT));
    }

    @Test
    public void testDetectorKeepsItsSettings() {
        CannyEdgeDetector detector = new CannyEdgeDetector(0.6, 0.2, BorderType.ZERO);
        assertEquals(0.6, detector.getHighThresholdRatio());
        assertEquals(0.2, detector.getLowThresholdRatio());
        assertEquals(BorderType.ZERO, detector.getBorder());
    }
}
