package com.conveyal.velmap.grid;

import org.locationtech.jts.geom.Envelope;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One layer of a geocoded raster on its own native lattice, as handed over by whatever reads the raster files.
 * Coordinate vectors may be supplied in either order (geocoded rasters usually list latitude from north to south)
 * and are normalized to increasing order on construction, reordering the values to match.
 *
 * Values are indexed [x][y] like every other array in this project. NaN marks no-data.
 */
public class RasterLayer {

    /**
     * Queries this close to the edge of the raster, in fractions of a cell, are still considered inside it. This
     * absorbs rounding in coordinates computed on another lattice.
     */
    private static final double EDGE_EPSILON = 1e-9;

    public final double[] x;

    public final double[] y;

    public final double[][] values;

    public RasterLayer (double[] x, double[] y, double[][] values) {
        checkNotNull(x);
        checkNotNull(y);
        checkNotNull(values);
        checkArgument(x.length >= 2 && y.length >= 2, "Rasters must have at least two rows and two columns.");
        checkArgument(values.length == x.length, "Raster has %s columns but %s x coordinates.", values.length, x.length);
        for (double[] column : values) {
            checkArgument(column.length == y.length, "Raster has %s rows but %s y coordinates.", column.length, y.length);
        }
        boolean flipX = x[x.length - 1] < x[0];
        boolean flipY = y[y.length - 1] < y[0];
        this.x = flipX ? reversed(x) : x.clone();
        this.y = flipY ? reversed(y) : y.clone();
        checkStrictlyIncreasing(this.x, "x");
        checkStrictlyIncreasing(this.y, "y");
        this.values = new double[x.length][];
        for (int i = 0; i < x.length; i++) {
            double[] column = values[flipX ? x.length - 1 - i : i];
            this.values[i] = flipY ? reversed(column) : column.clone();
        }
    }

    /**
     * Factory for row-major data as it comes out of most raster readers: rows[r][c] is the value at (x[c], y[r]).
     */
    public static RasterLayer fromRows (double[] x, double[] y, double[][] rows) {
        checkArgument(rows.length == y.length, "Raster has %s rows but %s y coordinates.", rows.length, y.length);
        double[][] values = new double[x.length][y.length];
        for (int r = 0; r < y.length; r++) {
            checkArgument(rows[r].length == x.length, "Row %s has %s values but there are %s x coordinates.",
                    r, rows[r].length, x.length);
            for (int c = 0; c < x.length; c++) {
                values[c][r] = rows[r][c];
            }
        }
        return new RasterLayer(x, y, values);
    }

    private static double[] reversed (double[] array) {
        double[] result = new double[array.length];
        for (int i = 0; i < array.length; i++) {
            result[i] = array[array.length - 1 - i];
        }
        return result;
    }

    private static void checkStrictlyIncreasing (double[] coordinates, String axis) {
        for (int i = 1; i < coordinates.length; i++) {
            checkArgument(coordinates[i] > coordinates[i - 1], "Raster %s coordinates must be monotonic.", axis);
        }
    }

    public int width () {
        return x.length;
    }

    public int height () {
        return y.length;
    }

    /** Native pixel spacing along x, averaged over the whole raster. */
    public double dx () {
        return (maxX() - minX()) / (x.length - 1);
    }

    /** Native pixel spacing along y, averaged over the whole raster. */
    public double dy () {
        return (maxY() - minY()) / (y.length - 1);
    }

    public double minX () {
        return x[0];
    }

    public double maxX () {
        return x[x.length - 1];
    }

    public double minY () {
        return y[0];
    }

    public double maxY () {
        return y[y.length - 1];
    }

    public Envelope getEnvelope () {
        return new Envelope(minX(), maxX(), minY(), maxY());
    }

    public boolean hasSameLattice (RasterLayer other) {
        return Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    public int countFinite () {
        int n = 0;
        for (double[] column : values) {
            for (double value : column) {
                if (Double.isFinite(value)) n += 1;
            }
        }
        return n;
    }

    /**
     * Bilinear interpolation at (qx, qy). Returns NaN outside the raster. A NaN corner poisons the result unless its
     * interpolation weight is zero. Queries within EDGE_EPSILON of a raster node or edge are snapped onto it, so they
     * return the values on that node or edge unchanged.
     */
    public double interpolate (double qx, double qy) {
        int i = lowerIndex(x, qx);
        int j = lowerIndex(y, qy);
        if (i < 0 || j < 0) {
            return Double.NaN;
        }
        double tx = (qx - x[i]) / (x[i + 1] - x[i]);
        double ty = (qy - y[j]) / (y[j + 1] - y[j]);
        tx = snap(tx);
        ty = snap(ty);
        double sum = 0;
        sum += weighted(values[i][j], (1 - tx) * (1 - ty));
        sum += weighted(values[i + 1][j], tx * (1 - ty));
        sum += weighted(values[i][j + 1], (1 - tx) * ty);
        sum += weighted(values[i + 1][j + 1], tx * ty);
        return sum;
    }

    private static double snap (double t) {
        if (t < EDGE_EPSILON) return 0;
        if (t > 1 - EDGE_EPSILON) return 1;
        return t;
    }

    private static double weighted (double value, double weight) {
        return weight == 0 ? 0 : value * weight;
    }

    /**
     * Index i of the interval [c[i], c[i+1]] containing q, or -1 if q is outside the coordinate range.
     */
    private static int lowerIndex (double[] c, double q) {
        double tolerance = EDGE_EPSILON * (c[1] - c[0]);
        if (!(q >= c[0] - tolerance && q <= c[c.length - 1] + tolerance)) {
            return -1;
        }
        int pos = Arrays.binarySearch(c, q);
        int i = pos >= 0 ? pos : -pos - 2;
        return Math.max(0, Math.min(c.length - 2, i));
    }

    /**
     * Aggregate blocks of factor x factor cells into single cells. Blocks at the far edges may be partial. The
     * coordinate of each output cell is the mean coordinate of its block.
     */
    public RasterLayer downsample (int factor, DownsampleMethod method) {
        checkArgument(factor >= 1, "Downsampling factor must be at least one.");
        if (factor == 1) {
            return this;
        }
        int outWidth = (x.length + factor - 1) / factor;
        int outHeight = (y.length + factor - 1) / factor;
        checkArgument(outWidth >= 2 && outHeight >= 2,
                "Downsampling by %s would leave fewer than two rows or columns.", factor);
        double[] outX = blockMeans(x, factor, outWidth);
        double[] outY = blockMeans(y, factor, outHeight);
        double[][] outValues = new double[outWidth][outHeight];
        for (int bi = 0; bi < outWidth; bi++) {
            int i0 = bi * factor;
            int i1 = Math.min(x.length, i0 + factor);
            for (int bj = 0; bj < outHeight; bj++) {
                int j0 = bj * factor;
                int j1 = Math.min(y.length, j0 + factor);
                double[] block = new double[(i1 - i0) * (j1 - j0)];
                int n = 0;
                for (int i = i0; i < i1; i++) {
                    for (int j = j0; j < j1; j++) {
                        block[n++] = values[i][j];
                    }
                }
                outValues[bi][bj] = method.aggregate(block);
            }
        }
        return new RasterLayer(outX, outY, outValues);
    }

    private static double[] blockMeans (double[] coordinates, int factor, int n) {
        double[] result = new double[n];
        for (int b = 0; b < n; b++) {
            int from = b * factor;
            int to = Math.min(coordinates.length, from + factor);
            double sum = 0;
            for (int k = from; k < to; k++) {
                sum += coordinates[k];
            }
            result[b] = sum / (to - from);
        }
        return result;
    }

    /** Resample this raster onto every node of the given grid. Nodes outside the raster become NaN. */
    public double[][] resample (GridExtents extents) {
        double[][] result = new double[extents.width][extents.height];
        for (int i = 0; i < extents.width; i++) {
            double qx = extents.x(i);
            for (int j = 0; j < extents.height; j++) {
                result[i][j] = interpolate(qx, extents.y(j));
            }
        }
        return result;
    }

}
