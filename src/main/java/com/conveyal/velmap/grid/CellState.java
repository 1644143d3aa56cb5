package com.conveyal.velmap.grid;

/**
 * The three states a cell of a stacked layer can be in. Outside a layer's footprint and inside it but invalid are
 * different things: overlap detection, merging and referencing all depend on telling them apart, so the state is
 * always derived from an explicit footprint rather than from the stored number.
 *
 * At storage and export boundaries layers are converted to the dense encoding where Exterior is 0 and Masked is NaN.
 */
public enum CellState {

    /** Outside the original footprint of the layer. */
    EXTERIOR,

    /** Inside the footprint but without a valid value (masked, no data, or outside the native raster). */
    MASKED,

    /** Inside the footprint with a finite value. */
    VALUE;

    public static CellState of (boolean inFootprint, double value) {
        if (!inFootprint) {
            return EXTERIOR;
        }
        return Double.isFinite(value) ? VALUE : MASKED;
    }

    /** The dense numeric encoding of a cell in this state holding the given value. */
    public double encode (double value) {
        switch (this) {
            case EXTERIOR:
                return 0;
            case MASKED:
                return Double.NaN;
            default:
                return value;
        }
    }

}
