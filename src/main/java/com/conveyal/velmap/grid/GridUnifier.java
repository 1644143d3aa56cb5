package com.conveyal.velmap.grid;

import com.conveyal.velmap.ConfigurationException;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.conveyal.velmap.util.DataQualityWarning.Type.EMPTY_LAYER;

/**
 * Resamples frames with heterogeneous native lattices onto one common grid and stacks them.
 *
 * The common spacing is the smallest spacing of any frame along each axis and the common extent is the union of
 * their bounding boxes. Each frame is only interpolated over the block of grid cells nearest to its own bounding
 * box: those cells form its footprint. Cells of that block falling on no-data in the native raster (or just outside
 * it) become Masked, and everything beyond it stays Exterior.
 *
 * Frames are independent of one another and are resampled on the worker pool.
 */
public class GridUnifier {

    private static final Logger LOG = LoggerFactory.getLogger(GridUnifier.class);

    /** Interpolated mask values at or above this are considered valid. */
    public static final double MASK_THRESHOLD = 0.5;

    public interface Config {
        boolean useMask ();
        /** Integer block size for downsampling all inputs before unification, zero or one to disable. */
        int downsampleFactor ();
        DownsampleMethod downsampleMethod ();
    }

    private final Config config;

    private final WorkerPool workerPool;

    public GridUnifier (Config config, WorkerPool workerPool) {
        this.config = config;
        this.workerPool = workerPool;
    }

    /**
     * Stack the given frames on a common grid, in the order given. Frames without a single valid velocity, either
     * on input or after masking, are dropped with a warning.
     * @throws ConfigurationException if no frames are given or none survive.
     */
    public VelocityStack unify (List<Frame> frames, DataQualityReport report) {
        if (frames.isEmpty()) {
            throw new ConfigurationException("No input frames were provided.");
        }
        List<Frame> usable = new ArrayList<>();
        for (Frame frame : frames) {
            if (frame.velocity.countFinite() == 0) {
                report.warn(EMPTY_LAYER, frame.id, "Velocity layer contains no valid values, removing frame.");
            } else {
                usable.add(frame);
            }
        }
        if (usable.isEmpty()) {
            throw new ConfigurationException("None of the input frames contain valid velocities.");
        }

        List<Frame> prepared = workerPool.map(usable, this::prepare);
        GridExtents extents = commonExtents(prepared);
        LOG.info("Unifying {} frames onto {}", prepared.size(), extents);

        List<StackLayer> layers = workerPool.map(prepared, frame -> regrid(frame, extents));
        List<StackLayer> valid = new ArrayList<>();
        for (StackLayer layer : layers) {
            if (layer.hasValidPixel()) {
                valid.add(layer);
            } else {
                report.warn(EMPTY_LAYER, layer.id, "No valid pixels remain after masking, removing frame.");
            }
        }
        if (valid.isEmpty()) {
            throw new ConfigurationException("No input frames contain valid pixels after masking.");
        }
        LOG.info("Grid unification complete, {} layers stacked.", valid.size());
        return new VelocityStack(extents, valid);
    }

    /**
     * Bring the unit vectors to the velocity sampling, then apply any configured downsampling to every layer.
     */
    Frame prepare (Frame frame) {
        int unitVectorFactor = frame.unitVectorAggregationFactor();
        if (unitVectorFactor > 1) {
            LOG.info("Aggregating unit vectors of {} by a factor of {}.", frame.id, unitVectorFactor);
            frame = frame.withUnitVectorsAggregated();
        }
        if (config.downsampleFactor() > 1) {
            frame = frame.downsample(config.downsampleFactor(), config.downsampleMethod());
        }
        return frame;
    }

    /** Minimum spacing and union bounding box of the velocity lattices of all frames. */
    public static GridExtents commonExtents (List<Frame> frames) {
        return GridExtents.forRasters(frames.stream().map(f -> f.velocity).collect(Collectors.toList()));
    }

    /**
     * Interpolate every layer of one frame onto the block of the common grid nearest to the frame's bounding box,
     * then apply the frame's mask if masking is enabled. Auxiliary layers are interpolated over the same block and
     * are not masked.
     */
    public StackLayer regrid (Frame frame, GridExtents extents) {
        StackLayer layer = StackLayer.empty(frame.id, frame.trackId, frame.passDirection, 0, extents);
        int xMin = extents.nearestColumn(frame.velocity.minX());
        int xMax = extents.nearestColumn(frame.velocity.maxX());
        int yMin = extents.nearestRow(frame.velocity.minY());
        int yMax = extents.nearestRow(frame.velocity.maxY());
        for (String name : frame.auxiliary.keySet()) {
            layer.newAuxiliary(name);
        }
        boolean applyMask = config.useMask() && frame.hasMask();
        int masked = 0;
        for (int x = xMin; x <= xMax; x++) {
            double qx = extents.x(x);
            for (int y = yMin; y <= yMax; y++) {
                double qy = extents.y(y);
                layer.footprint[x][y] = true;
                layer.velocity[x][y] = frame.velocity.interpolate(qx, qy);
                layer.uncertainty[x][y] = frame.uncertainty.interpolate(qx, qy);
                layer.east[x][y] = frame.east.interpolate(qx, qy);
                layer.north[x][y] = frame.north.interpolate(qx, qy);
                layer.up[x][y] = frame.up.interpolate(qx, qy);
                for (Map.Entry<String, RasterLayer> auxiliary : frame.auxiliary.entrySet()) {
                    layer.auxiliary.get(auxiliary.getKey())[x][y] = auxiliary.getValue().interpolate(qx, qy);
                }
                if (applyMask) {
                    // A NaN mask (outside the mask raster) neither validates nor invalidates the cell.
                    double maskValue = frame.mask.interpolate(qx, qy);
                    if (maskValue < MASK_THRESHOLD) {
                        layer.mask(x, y);
                        masked += 1;
                    }
                }
            }
        }
        LOG.debug("Regridded {} over columns {}-{} and rows {}-{}, {} cells masked.",
                frame.id, xMin, xMax, yMin, yMax, masked);
        return layer;
    }

}
