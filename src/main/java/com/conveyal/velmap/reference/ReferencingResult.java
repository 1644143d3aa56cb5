package com.conveyal.velmap.reference;

import com.conveyal.velmap.surface.SurfaceFit;

/**
 * The correction surface removed from one layer, kept for inspection. The correction is in the dense encoding:
 * 0 outside the layer footprint, NaN at masked cells.
 */
public class ReferencingResult {

    public final String layerId;

    /** Null if the layer was skipped. */
    public final double[][] correction;

    /** The fitted polynomial, null unless polynomial referencing was used. */
    public final SurfaceFit surface;

    public ReferencingResult (String layerId, double[][] correction, SurfaceFit surface) {
        this.layerId = layerId;
        this.correction = correction;
        this.surface = surface;
    }

    public static ReferencingResult skipped (String layerId) {
        return new ReferencingResult(layerId, null, null);
    }

    public boolean isReferenced () {
        return correction != null;
    }

}
