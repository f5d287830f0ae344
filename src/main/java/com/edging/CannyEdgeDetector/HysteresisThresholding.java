package com.edging.CannyEdgeDetector;

import com.edging.exception.InvalidThresholdException;
import com.edging.exception.ShapeMismatchException;
import com.edging.imageOperator.Dense2DArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Double-threshold classification with connectivity linking.
 * <ul>
 *     <li>strong: magnitude &gt;= high, always an edge</li>
 *     <li>weak: low &lt;= magnitude &lt; high, an edge only when 8-connected to a strong pixel
 *     through other weak or strong pixels</li>
 *     <li>suppressed: below low, or NaN</li>
 * </ul>
 * Thresholds are absolute magnitudes. The traversal is a breadth-first search seeded from the
 * strong pixels with a visited bitmap; every pixel enters the queue at most once.
 */
public class HysteresisThresholding {
    private static final Logger logger = LoggerFactory.getLogger(HysteresisThresholding.class);

    private HysteresisThresholding() {
    }

    public static void validateThresholds(double low, double high) {
        if (!Double.isFinite(low) || !Double.isFinite(high) || low < 0 || low >= high) {
            throw new InvalidThresholdException(low, high);
        }
    }

    public static EdgeMap hysteresis(Dense2DArray thinned, double low, double high) {
        validateThresholds(low, high);
        if (thinned.getChannels() != 1) {
            throw new ShapeMismatchException("Hysteresis needs a 1-channel array, got " + thinned.getChannels());
        }
        int height = thinned.getRows();
        int width = thinned.getCols();
        double[] mag = thinned.getData();
        double[] edges = new double[mag.length];

        boolean[] visited = new boolean[mag.length];
        int[] queue = new int[mag.length];
        int head = 0;
        int tail = 0;
        int components = 0;

        for (int seed = 0; seed < mag.length; seed++) {
            if (!(mag[seed] >= high) || visited[seed]) continue;
            components++;
            visited[seed] = true;
            queue[tail++] = seed;

            while (head < tail) {
                int p = queue[head++];
                edges[p] = EdgeMap.EDGE;
                int py = p / width;
                int px = p % width;
                for (int dy = -1; dy <= 1; dy++) {
                    int ny = py + dy;
                    if (ny < 0 || ny >= height) continue;
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = px + dx;
                        if ((dx == 0 && dy == 0) || nx < 0 || nx >= width) continue;
                        int q = ny * width + nx;
                        if (!visited[q] && isCandidate(mag[q], low)) {
                            visited[q] = true;
                            queue[tail++] = q;
                        }
                    }
                }
            }
        }

        logger.debug("Hysteresis low={} high={}: {} edge pixels in {} components", low, high, tail, components);
        return new EdgeMap(Dense2DArray.of(height, width, 1, edges));
    }

    private static boolean isCandidate(double magnitude, double low) {
        return magnitude >= low;
    }
}
