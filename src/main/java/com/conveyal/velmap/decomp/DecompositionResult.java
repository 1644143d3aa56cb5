package com.conveyal.velmap.decomp;

import com.conveyal.velmap.grid.GridExtents;

/**
 * Per-pixel output of a decomposition, as [x][y] arrays on the common grid. Pixels without a solution are NaN in
 * every value array and false in both quality masks. Flagged pixels keep their solved values.
 */
public class DecompositionResult {

    public final GridExtents extents;

    public final DecompositionMethod method;

    public final double[][] east;

    public final double[][] up;

    /**
     * Estimated North for ESTIMATE_NORTH, the reference North that was assumed for REMOVE_NORTH and TWO_STAGE, and
     * null for ZERO_NORTH.
     */
    public final double[][] north;

    public final double[][] varianceEast;

    public final double[][] varianceUp;

    /** Null when North is null. NaN where the North uncertainty is unknown. */
    public final double[][] varianceNorth;

    /** Condition number of the unweighted design matrix of each solved pixel. */
    public final double[][] conditionNumber;

    /** Number of valid observations available at each pixel, whether or not it was solved. */
    public final int[][] observationCount;

    /** Condition number above the configured threshold. */
    public final boolean[][] illConditioned;

    /** East or Up variance above the configured threshold. */
    public final boolean[][] highVariance;

    DecompositionResult (GridExtents extents, DecompositionMethod method) {
        this.extents = extents;
        this.method = method;
        this.east = extents.newArray(Double.NaN);
        this.up = extents.newArray(Double.NaN);
        this.varianceEast = extents.newArray(Double.NaN);
        this.varianceUp = extents.newArray(Double.NaN);
        if (method == DecompositionMethod.ZERO_NORTH) {
            this.north = null;
            this.varianceNorth = null;
        } else {
            this.north = extents.newArray(Double.NaN);
            this.varianceNorth = extents.newArray(Double.NaN);
        }
        this.conditionNumber = extents.newArray(Double.NaN);
        this.observationCount = new int[extents.width][extents.height];
        this.illConditioned = new boolean[extents.width][extents.height];
        this.highVariance = new boolean[extents.width][extents.height];
    }

    public boolean hasNorth () {
        return north != null;
    }

    public boolean isSolved (int x, int y) {
        return Double.isFinite(east[x][y]);
    }

    public int countSolved () {
        int n = 0;
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (isSolved(x, y)) n += 1;
            }
        }
        return n;
    }

    public int countIllConditioned () {
        return count(illConditioned);
    }

    public int countHighVariance () {
        return count(highVariance);
    }

    private static int count (boolean[][] mask) {
        int n = 0;
        for (boolean[] column : mask) {
            for (boolean flagged : column) {
                if (flagged) n += 1;
            }
        }
        return n;
    }

}
