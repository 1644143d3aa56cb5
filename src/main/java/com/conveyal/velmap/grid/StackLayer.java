package com.conveyal.velmap.grid;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One layer of a VelocityStack: a frame, a merged track or one segment of a split track, resampled onto the common
 * grid. Identity (layer id, track, pass direction, segment index) travels with the data so later stages never need
 * to infer it from positions or name prefixes.
 *
 * The footprint marks cells inside the original extent of the layer. The state of a cell is derived from the
 * footprint and the velocity value, see CellState. Value arrays are NaN outside the footprint and are mutated in
 * place by offset corrections and referencing.
 */
public class StackLayer {

    public final String id;

    public final String trackId;

    public final PassDirection passDirection;

    /** Zero unless this layer is one of several segments of a track that could not be merged as a whole. */
    public final int segmentIndex;

    public final GridExtents extents;

    public final boolean[][] footprint;

    public final double[][] velocity;

    public final double[][] uncertainty;

    public final double[][] east;

    public final double[][] north;

    public final double[][] up;

    /** Auxiliary scalar layers by name, NaN outside the footprint. Masking a cell leaves them untouched. */
    public final Map<String, double[][]> auxiliary;

    public StackLayer (String id, String trackId, PassDirection passDirection, int segmentIndex, GridExtents extents,
                       boolean[][] footprint, double[][] velocity, double[][] uncertainty,
                       double[][] east, double[][] north, double[][] up, Map<String, double[][]> auxiliary) {
        this.id = checkNotNull(id);
        this.trackId = checkNotNull(trackId);
        this.passDirection = checkNotNull(passDirection);
        checkArgument(segmentIndex >= 0);
        this.segmentIndex = segmentIndex;
        this.extents = checkNotNull(extents);
        this.footprint = checkNotNull(footprint);
        checkArgument(footprint.length == extents.width && footprint[0].length == extents.height,
                "Footprint does not match the grid.");
        this.velocity = velocity;
        this.uncertainty = uncertainty;
        this.east = east;
        this.north = north;
        this.up = up;
        this.auxiliary = checkNotNull(auxiliary);
        for (double[][] values : new double[][][] {velocity, uncertainty, east, north, up}) {
            extents.checkShape(values);
        }
        auxiliary.values().forEach(extents::checkShape);
    }

    /** A layer with an empty footprint and every value NaN, to be filled in by the caller. */
    public static StackLayer empty (String id, String trackId, PassDirection passDirection, int segmentIndex,
                                    GridExtents extents) {
        return new StackLayer(id, trackId, passDirection, segmentIndex, extents,
                new boolean[extents.width][extents.height],
                extents.newArray(Double.NaN), extents.newArray(Double.NaN),
                extents.newArray(Double.NaN), extents.newArray(Double.NaN), extents.newArray(Double.NaN),
                new LinkedHashMap<>());
    }

    /** Add an auxiliary layer that is NaN everywhere, to be filled in by the caller. */
    public double[][] newAuxiliary (String name) {
        double[][] values = extents.newArray(Double.NaN);
        auxiliary.put(name, values);
        return values;
    }

    public CellState state (int x, int y) {
        return CellState.of(footprint[x][y], velocity[x][y]);
    }

    public boolean isValue (int x, int y) {
        return footprint[x][y] && Double.isFinite(velocity[x][y]);
    }

    /**
     * True if the cell holds a complete observation: finite velocity, finite positive uncertainty and finite
     * direction cosines. Only such cells can contribute to a decomposition.
     */
    public boolean isCompleteObservation (int x, int y) {
        return isValue(x, y) && uncertainty[x][y] > 0 && Double.isFinite(uncertainty[x][y])
                && Double.isFinite(east[x][y]) && Double.isFinite(north[x][y]) && Double.isFinite(up[x][y]);
    }

    public boolean hasValidPixel () {
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (isValue(x, y)) return true;
            }
        }
        return false;
    }

    /** Smallest x coordinate of any valid cell, or NaN if there is none. */
    public double minValidX () {
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (isValue(x, y)) return extents.x(x);
            }
        }
        return Double.NaN;
    }

    /** Smallest y coordinate of any valid cell, or NaN if there is none. */
    public double minValidY () {
        for (int y = 0; y < extents.height; y++) {
            for (int x = 0; x < extents.width; x++) {
                if (isValue(x, y)) return extents.y(y);
            }
        }
        return Double.NaN;
    }

    /** Make the cell invalid (Masked) in all value layers. It stays inside the footprint. */
    public void mask (int x, int y) {
        velocity[x][y] = Double.NaN;
        uncertainty[x][y] = Double.NaN;
        east[x][y] = Double.NaN;
        north[x][y] = Double.NaN;
        up[x][y] = Double.NaN;
    }

    /** Deep copy with a new identity, e.g. when a frame becomes a single-frame track segment. */
    public StackLayer copyAs (String newId, int newSegmentIndex) {
        Map<String, double[][]> auxiliaryCopy = new LinkedHashMap<>();
        auxiliary.forEach((name, values) -> auxiliaryCopy.put(name, copy(values)));
        return new StackLayer(newId, trackId, passDirection, newSegmentIndex, extents, copy(footprint),
                copy(velocity), copy(uncertainty), copy(east), copy(north), copy(up), auxiliaryCopy);
    }

    public StackLayer copy () {
        return copyAs(id, segmentIndex);
    }

    /**
     * Convert one of this layer's value arrays to the dense encoding used at export boundaries, where cells outside
     * the footprint are 0 and masked cells are NaN.
     */
    public double[][] toDense (double[][] values) {
        double[][] dense = new double[extents.width][extents.height];
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                dense[x][y] = footprint[x][y] ? values[x][y] : 0;
            }
        }
        return dense;
    }

    public static double[][] copy (double[][] array) {
        double[][] result = new double[array.length][];
        for (int i = 0; i < array.length; i++) {
            result[i] = array[i].clone();
        }
        return result;
    }

    public static boolean[][] copy (boolean[][] array) {
        boolean[][] result = new boolean[array.length][];
        for (int i = 0; i < array.length; i++) {
            result[i] = array[i].clone();
        }
        return result;
    }

    @Override
    public String toString () {
        return String.format("Layer %s (track %s, %s, segment %d)", id, trackId, passDirection, segmentIndex);
    }

}
