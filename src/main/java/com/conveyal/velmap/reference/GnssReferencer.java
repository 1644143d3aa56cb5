package com.conveyal.velmap.reference;

import com.conveyal.velmap.ConfigurationException;
import com.conveyal.velmap.grid.CellState;
import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.ReferenceField;
import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.surface.MovingAverageFilter;
import com.conveyal.velmap.surface.SurfaceFit;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.WorkerPool;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.conveyal.velmap.util.DataQualityWarning.Type.DEGENERATE_FIT;
import static com.conveyal.velmap.util.DataQualityWarning.Type.EMPTY_LAYER;

/**
 * Ties each layer of a stack to an external reference velocity field, usually interpolated from GNSS stations.
 *
 * For every layer the reference field is projected into the layer's line of sight and subtracted from the observed
 * velocity. A smooth correction surface is estimated from this residual, either as a polynomial or by filtering, and
 * removed from the layer. Large localized signals such as subsidence would drag the surface towards themselves, so
 * cells deviating by more than {@link #LARGE_SIGNAL_THRESHOLD} from a planar trend are left out of the residual.
 * With a polynomial that masking only affects the estimate, every valid cell of the layer is corrected. A filtered
 * surface is restricted to the cells of the residual, so with a filter those cells become masked along with any cell
 * lacking a reference value.
 *
 * Layers are corrected in place and independently of one another, on the worker pool.
 */
public class GnssReferencer {

    private static final Logger LOG = LoggerFactory.getLogger(GnssReferencer.class);

    /** Cells whose deramped and recentered velocity exceeds this magnitude are left out of the residual. */
    public static final double LARGE_SIGNAL_THRESHOLD = 10;

    public interface Config {
        ReferenceMethod referenceMethod ();
        /** Order of the polynomial surface, 1 or 2. Only needed for polynomial referencing. */
        Integer referencePolyOrder ();
        /** Odd window size of the moving-average filter in cells. Only needed for filter referencing. */
        Integer referenceFilterWindow ();
    }

    private final ReferenceMethod method;

    private final int polyOrder;

    private final MovingAverageFilter filter;

    private final WorkerPool workerPool;

    /**
     * @throws ConfigurationException if the parameters required by the selected method are missing or invalid.
     */
    public GnssReferencer (Config config, WorkerPool workerPool) {
        this.method = config.referenceMethod();
        this.workerPool = workerPool;
        if (method == ReferenceMethod.POLYNOMIAL) {
            Integer order = config.referencePolyOrder();
            if (order == null) {
                throw new ConfigurationException("A polynomial order must be set when referencing with a polynomial.");
            }
            if (order != 1 && order != 2) {
                throw new ConfigurationException("Polynomial order for referencing must be 1 or 2, not " + order);
            }
            polyOrder = order;
        } else {
            polyOrder = 0;
        }
        if (method == ReferenceMethod.FILTER) {
            Integer window = config.referenceFilterWindow();
            if (window == null) {
                throw new ConfigurationException("A filter window size must be set when referencing with a filter.");
            }
            filter = new MovingAverageFilter(window);
        } else {
            filter = null;
        }
    }

    /**
     * Reference every layer of the stack in place.
     * @param reference the reference field on the grid of the stack.
     * @return one result per layer, in stack order.
     */
    public List<ReferencingResult> reference (VelocityStack stack, ReferenceField.Gridded reference,
                                              DataQualityReport report) {
        if (method == ReferenceMethod.NONE) {
            throw new IllegalStateException("Referencing method is NONE, nothing to do.");
        }
        if (!stack.extents.equals(reference.extents)) {
            throw new IllegalArgumentException("Reference field is not on the grid of the stack.");
        }
        LOG.info("Referencing {} layers using {}.", stack.size(), method);
        return workerPool.map(stack.getLayers(), layer -> referenceLayer(layer, reference, report));
    }

    ReferencingResult referenceLayer (StackLayer layer, ReferenceField.Gridded reference, DataQualityReport report) {
        if (!layer.hasValidPixel()) {
            report.warn(EMPTY_LAYER, layer.id, "Layer has no valid pixels, skipping referencing.");
            return ReferencingResult.skipped(layer.id);
        }
        double[][] residual = residual(layer, reference);
        if (!hasFiniteValue(residual)) {
            report.warn(EMPTY_LAYER, layer.id,
                    "No valid residual against the reference field after masking, skipping referencing.");
            return ReferencingResult.skipped(layer.id);
        }
        SurfaceFit fit = null;
        double[][] surface;
        if (method == ReferenceMethod.POLYNOMIAL) {
            try {
                fit = SurfaceFit.fitGrid(polyOrder, layer.extents, residual, true);
            } catch (SingularMatrixException e) {
                report.warn(DEGENERATE_FIT, layer.id, String.format(
                        "Residual cannot constrain a surface of order %d, skipping referencing.", polyOrder));
                return ReferencingResult.skipped(layer.id);
            }
            LOG.debug("Layer {} correction surface {}", layer.id, fit);
            surface = fit.evaluate(layer.extents);
        } else {
            surface = filter.apply(residual);
            // The filtered surface is only defined where the residual itself was.
            for (int x = 0; x < surface.length; x++) {
                for (int y = 0; y < surface[x].length; y++) {
                    if (Double.isNaN(residual[x][y])) surface[x][y] = Double.NaN;
                }
            }
        }
        double[][] correction = applyCorrection(layer, surface);
        return new ReferencingResult(layer.id, correction, fit);
    }

    /**
     * Observed velocity minus the reference projected into the line of sight, NaN where either is missing and at
     * cells carrying a large local signal.
     */
    double[][] residual (StackLayer layer, ReferenceField.Gridded reference) {
        GridExtents extents = layer.extents;
        double[][] velocity = extents.newArray(Double.NaN);
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (layer.isValue(x, y)) velocity[x][y] = layer.velocity[x][y];
            }
        }
        maskLargeSignals(layer.id, velocity, extents);
        double[][] residual = extents.newArray(Double.NaN);
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                residual[x][y] = velocity[x][y] - reference.lineOfSight(layer, x, y);
            }
        }
        return residual;
    }

    private static boolean hasFiniteValue (double[][] values) {
        for (double[] column : values) {
            for (double value : column) {
                if (Double.isFinite(value)) return true;
            }
        }
        return false;
    }

    /**
     * Remove a planar trend, recenter to zero mean and set every cell still exceeding the threshold to NaN.
     */
    private static void maskLargeSignals (String layerId, double[][] velocity, GridExtents extents) {
        SurfaceFit ramp;
        try {
            ramp = SurfaceFit.fitGrid(1, extents, velocity, true);
        } catch (SingularMatrixException e) {
            LOG.warn("Cannot deramp layer {}, large signals are not masked before referencing.", layerId);
            return;
        }
        double[][] deramped = extents.newArray(Double.NaN);
        double sum = 0;
        int n = 0;
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (Double.isFinite(velocity[x][y])) {
                    deramped[x][y] = velocity[x][y] - ramp.evaluate(extents.x(x), extents.y(y));
                    sum += deramped[x][y];
                    n += 1;
                }
            }
        }
        double mean = sum / n;
        int masked = 0;
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (Math.abs(deramped[x][y] - mean) > LARGE_SIGNAL_THRESHOLD) {
                    velocity[x][y] = Double.NaN;
                    masked += 1;
                }
            }
        }
        LOG.debug("Masked {} cells with large signals in layer {} before referencing.", masked, layerId);
    }

    /**
     * Restrict the correction surface to the layer's cell states and subtract it from every valid cell. A valid cell
     * where the surface is undefined becomes masked.
     * @return the correction in the dense encoding, 0 outside the footprint and NaN at masked cells.
     */
    private static double[][] applyCorrection (StackLayer layer, double[][] surface) {
        GridExtents extents = layer.extents;
        double[][] correction = new double[extents.width][extents.height];
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                CellState state = layer.state(x, y);
                if (state == CellState.VALUE) {
                    if (Double.isFinite(surface[x][y])) {
                        layer.velocity[x][y] -= surface[x][y];
                    } else {
                        layer.mask(x, y);
                        state = CellState.MASKED;
                    }
                }
                correction[x][y] = state.encode(surface[x][y]);
            }
        }
        return correction;
    }

}
