package com.conveyal.velmap.reference;

import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.RasterLayer;
import com.conveyal.velmap.grid.StackLayer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A bias velocity given as East, North and optionally Up components on the common grid, projected into each layer's
 * line of sight using the layer's direction cosines.
 */
public class EnuBiasField implements BiasField {

    private final GridExtents extents;

    private final double[][] east;

    private final double[][] north;

    /** Null if the bias is purely horizontal. */
    private final double[][] up;

    public EnuBiasField (GridExtents extents, double[][] east, double[][] north, double[][] up) {
        this.extents = checkNotNull(extents);
        extents.checkShape(east);
        extents.checkShape(north);
        if (up != null) extents.checkShape(up);
        this.east = east;
        this.north = north;
        this.up = up;
    }

    /** Resample bias components given on their own lattice onto the common grid. Up may be null. */
    public static EnuBiasField resample (GridExtents extents, RasterLayer east, RasterLayer north, RasterLayer up) {
        return new EnuBiasField(extents, east.resample(extents), north.resample(extents),
                up == null ? null : up.resample(extents));
    }

    @Override
    public double[][] lineOfSightBias (StackLayer layer) {
        checkArgument(extents.equals(layer.extents), "Bias field and layer %s are on different grids.", layer.id);
        double[][] bias = new double[extents.width][extents.height];
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                double b = east[x][y] * layer.east[x][y] + north[x][y] * layer.north[x][y];
                if (up != null) {
                    b += up[x][y] * layer.up[x][y];
                }
                bias[x][y] = b;
            }
        }
        return bias;
    }

}
