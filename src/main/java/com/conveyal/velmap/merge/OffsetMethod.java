package com.conveyal.velmap.merge;

import com.conveyal.velmap.surface.SurfaceFit;
import com.conveyal.velmap.util.NanStatistics;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The function estimating the correction between two overlapping frames from the velocity differences over their
 * overlap. Every method yields a surface, which is a constant for all of them except PLANAR.
 */
public enum OffsetMethod {

    /** Mean of the overlap differences. */
    MEAN,

    /** First order ramp fitted to the overlap differences by least squares, in grid coordinates. */
    PLANAR,

    /** Median of the overlap differences. */
    MEDIAN,

    /** Most frequent overlap difference after rounding to one decimal place. */
    MODE;

    private static final Logger LOG = LoggerFactory.getLogger(OffsetMethod.class);

    /**
     * @param xs x coordinates of the overlap cells.
     * @param ys y coordinates of the overlap cells.
     * @param differences later frame minus earlier frame at each overlap cell.
     */
    public SurfaceFit estimate (double[] xs, double[] ys, double[] differences) {
        switch (this) {
            case PLANAR:
                try {
                    return SurfaceFit.fit(1, xs, ys, differences, false);
                } catch (SingularMatrixException e) {
                    LOG.warn("Overlap of {} cells cannot constrain a ramp, removing the mean difference instead.",
                            differences.length);
                    return constant(NanStatistics.mean(differences));
                }
            case MEDIAN:
                return constant(NanStatistics.median(differences));
            case MODE:
                return constant(NanStatistics.mode(differences));
            default:
                return constant(NanStatistics.mean(differences));
        }
    }

    private static SurfaceFit constant (double offset) {
        return new SurfaceFit(0, 0, 0, new double[] {offset});
    }

}
