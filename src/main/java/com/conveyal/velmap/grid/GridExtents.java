package com.conveyal.velmap.grid;

import org.locationtech.jts.geom.Envelope;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * The common lattice onto which all frames are resampled: monotonically increasing x (east) and y (north) coordinate
 * vectors with uniform spacing. Column 0 is the westernmost column and row 0 the southernmost row. Arrays on this
 * lattice are indexed [x][y]. Equals and hashcode are semantic, so two layers can be checked for a shared lattice.
 *
 * Extents are immutable. Methods that "grow" extents return a new instance.
 */
public class GridExtents implements Serializable {

    /** Limit on cells per layer, to prevent running out of memory when many layers are stacked. */
    private static final int MAX_GRID_CELLS = 50_000_000;

    /**
     * Tolerance in fractions of a cell when counting how many whole cells fit between two coordinates. Coordinate
     * vectors read from geocoded rasters are often accumulated sums of a spacing that is not exactly representable.
     */
    private static final double CELL_EPSILON = 1e-6;

    /** X coordinate of column 0. */
    public final double west;

    /** Y coordinate of row 0. */
    public final double south;

    public final double dx;

    public final double dy;

    /** Number of columns. */
    public final int width;

    /** Number of rows. */
    public final int height;

    public GridExtents (double west, double south, double dx, double dy, int width, int height) {
        checkArgument(dx > 0 && dy > 0, "Grid spacing must be positive.");
        checkArgument(width > 0 && height > 0, "Grid must have at least one row and one column.");
        this.west = west;
        this.south = south;
        this.dx = dx;
        this.dy = dy;
        this.width = width;
        this.height = height;
        checkGridSize();
    }

    /**
     * Lattice whose first node is at the lower left corner of the envelope, with as many whole cells of the given
     * spacing as fit inside it. This mirrors the colon operator xmin : dx : xmax, which never overshoots xmax.
     */
    public static GridExtents forEnvelope (Envelope envelope, double dx, double dy) {
        checkArgument(!envelope.isNull(), "Cannot create grid extents from an empty envelope.");
        int width = (int) Math.floor(envelope.getWidth() / dx + CELL_EPSILON) + 1;
        int height = (int) Math.floor(envelope.getHeight() / dy + CELL_EPSILON) + 1;
        return new GridExtents(envelope.getMinX(), envelope.getMinY(), dx, dy, width, height);
    }

    /**
     * The common lattice for a set of native rasters: spacing is the minimum spacing along each axis over all of them,
     * and the extent is the union of their bounding boxes.
     */
    public static GridExtents forRasters (Collection<RasterLayer> rasters) {
        checkArgument(!rasters.isEmpty(), "At least one raster is needed to establish grid extents.");
        Envelope union = new Envelope();
        double dx = Double.POSITIVE_INFINITY;
        double dy = Double.POSITIVE_INFINITY;
        for (RasterLayer raster : rasters) {
            union.expandToInclude(raster.getEnvelope());
            dx = Math.min(dx, raster.dx());
            dy = Math.min(dy, raster.dy());
        }
        return forEnvelope(union, dx, dy);
    }

    public double x (int column) {
        checkElementIndex(column, width);
        return west + column * dx;
    }

    public double y (int row) {
        checkElementIndex(row, height);
        return south + row * dy;
    }

    public double east () {
        return west + (width - 1) * dx;
    }

    public double north () {
        return south + (height - 1) * dy;
    }

    /** Index of the column whose coordinate is nearest to x, clamped to the grid. */
    public int nearestColumn (double x) {
        return clamp((int) Math.round((x - west) / dx), width);
    }

    /** Index of the row whose coordinate is nearest to y, clamped to the grid. */
    public int nearestRow (double y) {
        return clamp((int) Math.round((y - south) / dy), height);
    }

    private static int clamp (int i, int n) {
        return Math.max(0, Math.min(n - 1, i));
    }

    public int cellCount () {
        return width * height;
    }

    /** Allocate an array of the shape [width][height] filled with the given value. */
    public double[][] newArray (double fill) {
        double[][] array = new double[width][height];
        if (fill != 0) {
            for (double[] column : array) {
                Arrays.fill(column, fill);
            }
        }
        return array;
    }

    /** Check that a [x][y] array has the shape of this grid. */
    public void checkShape (double[][] array) {
        checkArgument(array.length == width, "Array width %s does not match grid width %s.", array.length, width);
        for (double[] column : array) {
            checkArgument(column.length == height, "Array height %s does not match grid height %s.",
                    column.length, height);
        }
    }

    private void checkGridSize () {
        checkState((long) width * height <= MAX_GRID_CELLS,
                "Grid of %s x %s cells exceeds the limit of %s cells.", width, height, MAX_GRID_CELLS);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GridExtents other = (GridExtents) o;
        return width == other.width && height == other.height &&
                Double.compare(west, other.west) == 0 && Double.compare(south, other.south) == 0 &&
                Double.compare(dx, other.dx) == 0 && Double.compare(dy, other.dy) == 0;
    }

    @Override
    public int hashCode () {
        int result = Double.hashCode(west);
        result = 31 * result + Double.hashCode(south);
        result = 31 * result + Double.hashCode(dx);
        result = 31 * result + Double.hashCode(dy);
        result = 31 * result + width;
        result = 31 * result + height;
        return result;
    }

    @Override
    public String toString () {
        return String.format("GridExtents[west=%s, south=%s, dx=%s, dy=%s, %dx%d]", west, south, dx, dy, width, height);
    }

}
