package com.conveyal.velmap.grid;

import com.conveyal.velmap.ConfigurationException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An independent East/North ground velocity field, usually interpolated from continuous GNSS stations, on its own
 * lattice. It is used to remove reference frame bias from the line-of-sight velocities and to supply the North
 * component that two look directions cannot resolve. Uncertainties are optional.
 */
public class ReferenceField {

    public final RasterLayer east;

    public final RasterLayer north;

    /** One-sigma uncertainty of the East component, or null. */
    public final RasterLayer sigmaEast;

    /** One-sigma uncertainty of the North component, or null. */
    public final RasterLayer sigmaNorth;

    public ReferenceField (RasterLayer east, RasterLayer north) {
        this(east, north, null, null);
    }

    public ReferenceField (RasterLayer east, RasterLayer north, RasterLayer sigmaEast, RasterLayer sigmaNorth) {
        this.east = checkNotNull(east);
        this.north = checkNotNull(north);
        checkArgument((sigmaEast == null) == (sigmaNorth == null),
                "Reference uncertainties must be supplied for both East and North or for neither.");
        this.sigmaEast = sigmaEast;
        this.sigmaNorth = sigmaNorth;
    }

    public boolean hasUncertainty () {
        return sigmaEast != null;
    }

    /**
     * Interpolate the field onto every node of the common grid.
     * @param withUncertainty whether uncertainties should be carried along, in which case they must be present.
     */
    public Gridded resample (GridExtents extents, boolean withUncertainty) {
        if (withUncertainty && !hasUncertainty()) {
            throw new ConfigurationException(
                    "Propagation of reference field uncertainties requested, but the field has no uncertainties.");
        }
        return new Gridded(extents, east.resample(extents), north.resample(extents),
                withUncertainty ? sigmaEast.resample(extents) : null,
                withUncertainty ? sigmaNorth.resample(extents) : null);
    }

    /** The reference field on the common grid, NaN where the field does not reach. */
    public static class Gridded {

        public final GridExtents extents;
        public final double[][] east;
        public final double[][] north;
        public final double[][] sigmaEast;
        public final double[][] sigmaNorth;

        public Gridded (GridExtents extents, double[][] east, double[][] north,
                        double[][] sigmaEast, double[][] sigmaNorth) {
            this.extents = checkNotNull(extents);
            extents.checkShape(east);
            extents.checkShape(north);
            if (sigmaEast != null) extents.checkShape(sigmaEast);
            if (sigmaNorth != null) extents.checkShape(sigmaNorth);
            this.east = east;
            this.north = north;
            this.sigmaEast = sigmaEast;
            this.sigmaNorth = sigmaNorth;
        }

        public boolean hasUncertainty () {
            return sigmaNorth != null;
        }

        /** Projection of the reference velocity into the line of sight of a layer at one cell. */
        public double lineOfSight (StackLayer layer, int x, int y) {
            return east[x][y] * layer.east[x][y] + north[x][y] * layer.north[x][y];
        }

    }

}
