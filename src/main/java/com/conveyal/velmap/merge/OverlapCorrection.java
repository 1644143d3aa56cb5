package com.conveyal.velmap.merge;

/**
 * The correction applied to one frame to bring it into line with the preceding frame of its track, with statistics
 * of their differences over the overlap before and after correction.
 */
public class OverlapCorrection {

    public final String trackId;

    /** The already corrected frame the other one was aligned to. */
    public final String referenceFrameId;

    public final String correctedFrameId;

    public final int overlapCells;

    public final OffsetMethod method;

    /** Coefficients of the removed surface: one constant, or the constant, x and y terms of a ramp. */
    public final double[] coefficients;

    public final double meanDifferenceBefore;

    public final double meanDifferenceAfter;

    public OverlapCorrection (String trackId, String referenceFrameId, String correctedFrameId, int overlapCells,
                              OffsetMethod method, double[] coefficients,
                              double meanDifferenceBefore, double meanDifferenceAfter) {
        this.trackId = trackId;
        this.referenceFrameId = referenceFrameId;
        this.correctedFrameId = correctedFrameId;
        this.overlapCells = overlapCells;
        this.method = method;
        this.coefficients = coefficients;
        this.meanDifferenceBefore = meanDifferenceBefore;
        this.meanDifferenceAfter = meanDifferenceAfter;
    }

    @Override
    public String toString () {
        return String.format("%s -> %s over %d cells: mean difference %.3f before, %.3f after",
                referenceFrameId, correctedFrameId, overlapCells, meanDifferenceBefore, meanDifferenceAfter);
    }

}
