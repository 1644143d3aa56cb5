package com.conveyal.velmap.surface;

import com.conveyal.velmap.ConfigurationException;

/**
 * Square moving-average (rectangular window) filter over [x][y] arrays that ignores NaN cells. Each output cell is
 * the mean of the finite input cells within the window centered on it, with the window truncated at the array edges.
 * Output cells whose window contains no finite input are NaN.
 *
 * Window sums are read from summed-area tables, so the cost does not depend on the window size.
 */
public class MovingAverageFilter {

    public final int windowSize;

    /**
     * @throws ConfigurationException if the window size is not a positive odd number, as the window must be centered
     *         on a cell.
     */
    public MovingAverageFilter (int windowSize) {
        if (windowSize < 1 || windowSize % 2 != 1) {
            throw new ConfigurationException("Filter window size must be a positive odd number, not " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public double[][] apply (double[][] values) {
        int width = values.length;
        int height = values[0].length;
        // Tables are one larger than the input along each axis, with a zero first row and column.
        double[][] sums = new double[width + 1][height + 1];
        int[][] counts = new int[width + 1][height + 1];
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                double v = values[x][y];
                boolean finite = Double.isFinite(v);
                sums[x + 1][y + 1] = (finite ? v : 0) + sums[x][y + 1] + sums[x + 1][y] - sums[x][y];
                counts[x + 1][y + 1] = (finite ? 1 : 0) + counts[x][y + 1] + counts[x + 1][y] - counts[x][y];
            }
        }
        int half = windowSize / 2;
        double[][] result = new double[width][height];
        for (int x = 0; x < width; x++) {
            int x0 = Math.max(0, x - half);
            int x1 = Math.min(width, x + half + 1);
            for (int y = 0; y < height; y++) {
                int y0 = Math.max(0, y - half);
                int y1 = Math.min(height, y + half + 1);
                int n = counts[x1][y1] - counts[x0][y1] - counts[x1][y0] + counts[x0][y0];
                if (n == 0) {
                    result[x][y] = Double.NaN;
                } else {
                    double sum = sums[x1][y1] - sums[x0][y1] - sums[x1][y0] + sums[x0][y0];
                    result[x][y] = sum / n;
                }
            }
        }
        return result;
    }

}
