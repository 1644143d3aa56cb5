package com.conveyal.velmap.merge;

import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.surface.SurfaceFit;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.NanStatistics;
import com.conveyal.velmap.util.WorkerPool;
import gnu.trove.list.array.TDoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.conveyal.velmap.util.DataQualityWarning.Type.NO_OVERLAP;

/**
 * Stitches the frames of each track into continuous along-track profiles.
 *
 * Within a track, frames are visited in along-track order and each one is corrected relative to its predecessor,
 * which has already been corrected itself, so corrections accumulate down the track. A pair without any jointly
 * valid cell cannot be aligned: the track is split there and the next frame starts a new segment. In MERGE mode the
 * frames of each segment are then combined into a single layer, weighting velocities by inverse uncertainty.
 *
 * Tracks are independent of one another and are processed in parallel. The input stack is not modified.
 */
public class AlongTrackMerger {

    private static final Logger LOG = LoggerFactory.getLogger(AlongTrackMerger.class);

    public interface Config {
        MergeMode mergeAlongTrack ();
        OffsetMethod mergeAlongTrackMethod ();
    }

    /** Output of one along-track merge. */
    public static class Result {

        public final VelocityStack stack;

        public final List<TrackSegment> segments;

        public final List<OverlapCorrection> corrections;

        public Result (VelocityStack stack, List<TrackSegment> segments, List<OverlapCorrection> corrections) {
            this.stack = stack;
            this.segments = segments;
            this.corrections = corrections;
        }

        /** Identifiers of the output layers, with a segment suffix for tracks that had to be split. */
        public List<String> layerIds () {
            return stack.layerIds();
        }

    }

    /** Everything produced for one track, before tracks are concatenated. */
    private static class TrackResult {
        final List<StackLayer> layers = new ArrayList<>();
        final List<TrackSegment> segments = new ArrayList<>();
        final List<OverlapCorrection> corrections = new ArrayList<>();
    }

    private final Config config;

    private final WorkerPool workerPool;

    public AlongTrackMerger (Config config, WorkerPool workerPool) {
        this.config = config;
        this.workerPool = workerPool;
    }

    public Result merge (VelocityStack stack, DataQualityReport report) {
        if (config.mergeAlongTrack() == MergeMode.NONE) {
            LOG.info("Along-track merging disabled.");
            return new Result(stack.copy(), Collections.emptyList(), Collections.emptyList());
        }
        Map<String, List<StackLayer>> layersByTrack = new TreeMap<>();
        for (StackLayer layer : stack.getLayers()) {
            layersByTrack.computeIfAbsent(layer.trackId, t -> new ArrayList<>()).add(layer);
        }
        LOG.info("Merging {} layers along {} tracks using {} offsets.", stack.size(), layersByTrack.size(),
                config.mergeAlongTrackMethod());
        List<TrackResult> trackResults = workerPool.map(new ArrayList<>(layersByTrack.values()),
                layers -> mergeTrack(layers, stack.extents, report));

        List<StackLayer> layers = new ArrayList<>();
        List<TrackSegment> segments = new ArrayList<>();
        List<OverlapCorrection> corrections = new ArrayList<>();
        for (TrackResult trackResult : trackResults) {
            layers.addAll(trackResult.layers);
            segments.addAll(trackResult.segments);
            corrections.addAll(trackResult.corrections);
        }
        LOG.info("Along-track merging produced {} layers in {} segments.", layers.size(), segments.size());
        return new Result(new VelocityStack(stack.extents, layers), segments, corrections);
    }

    /** Along-track order: southernmost valid row first, ties broken by identifier. */
    static final Comparator<StackLayer> ALONG_TRACK_ORDER =
            Comparator.comparingDouble(StackLayer::minValidY).thenComparing(l -> l.id);

    private TrackResult mergeTrack (List<StackLayer> trackLayers, GridExtents extents, DataQualityReport report) {
        List<StackLayer> frames = trackLayers.stream()
                .map(StackLayer::copy)
                .sorted(ALONG_TRACK_ORDER)
                .collect(Collectors.toList());
        String trackId = frames.get(0).trackId;
        TrackResult result = new TrackResult();

        // Fold over adjacent pairs, closing the current segment whenever a pair does not overlap.
        List<List<StackLayer>> segmentFrames = new ArrayList<>();
        List<StackLayer> current = new ArrayList<>();
        current.add(frames.get(0));
        for (int k = 1; k < frames.size(); k++) {
            StackLayer previous = frames.get(k - 1);
            StackLayer next = frames.get(k);
            OverlapCorrection correction = correctPair(trackId, previous, next, extents);
            if (correction == null) {
                report.warn(NO_OVERLAP, trackId, String.format(
                        "Frames %s and %s do not overlap, splitting track.", previous.id, next.id));
                segmentFrames.add(current);
                current = new ArrayList<>();
            } else {
                LOG.debug("Track {}: {}", trackId, correction);
                result.corrections.add(correction);
            }
            current.add(next);
        }
        segmentFrames.add(current);

        for (int s = 0; s < segmentFrames.size(); s++) {
            List<StackLayer> segment = segmentFrames.get(s);
            List<String> frameIds = segment.stream().map(l -> l.id).collect(Collectors.toList());
            List<StackLayer> outputLayers = new ArrayList<>();
            if (config.mergeAlongTrack() == MergeMode.MERGE) {
                String layerId = segmentFrames.size() == 1 ? trackId : trackId + "_" + (s + 1);
                outputLayers.add(combine(segment, layerId, s, extents));
            } else {
                for (StackLayer frame : segment) {
                    outputLayers.add(frame.copyAs(frame.id, s));
                }
            }
            result.layers.addAll(outputLayers);
            result.segments.add(new TrackSegment(trackId, segment.get(0).passDirection, s, frameIds,
                    outputLayers.stream().map(l -> l.id).collect(Collectors.toList())));
        }
        return result;
    }

    /**
     * Estimate the correction of the next frame relative to the previous one from their differences at cells where
     * both are valid, and subtract it from every valid cell of the next frame.
     * @return a record of the correction, or null if the frames share no valid cell.
     */
    OverlapCorrection correctPair (String trackId, StackLayer previous, StackLayer next, GridExtents extents) {
        TDoubleArrayList xs = new TDoubleArrayList();
        TDoubleArrayList ys = new TDoubleArrayList();
        TDoubleArrayList differences = new TDoubleArrayList();
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (previous.isValue(x, y) && next.isValue(x, y)) {
                    xs.add(extents.x(x));
                    ys.add(extents.y(y));
                    differences.add(next.velocity[x][y] - previous.velocity[x][y]);
                }
            }
        }
        if (differences.isEmpty()) {
            return null;
        }
        OffsetMethod method = config.mergeAlongTrackMethod();
        SurfaceFit fit = method.estimate(xs.toArray(), ys.toArray(), differences.toArray());
        for (int x = 0; x < extents.width; x++) {
            double qx = extents.x(x);
            for (int y = 0; y < extents.height; y++) {
                if (next.isValue(x, y)) {
                    next.velocity[x][y] -= fit.evaluate(qx, extents.y(y));
                }
            }
        }
        double[] after = new double[differences.size()];
        for (int i = 0; i < after.length; i++) {
            after[i] = differences.get(i) - fit.evaluate(xs.get(i), ys.get(i));
        }
        return new OverlapCorrection(trackId, previous.id, next.id, differences.size(), method, fit.coefficients,
                NanStatistics.mean(differences.toArray()), NanStatistics.mean(after));
    }

    /**
     * Combine the frames of one segment into a single layer. The footprint is the union of the frame footprints.
     * Velocity is the mean of the valid values weighted by w = 1/uncertainty and the merged uncertainty is
     * 1/sqrt(sum of w). Cells valid in a single frame keep that frame's velocity. Unit vectors are the plain mean of
     * the frames' finite values. Auxiliary layers are the plain mean of the finite values of the frames carrying them,
     * over the whole merged footprint. A segment of one frame is copied unchanged, so merging a merged track is a
     * no-op.
     */
    static StackLayer combine (List<StackLayer> segment, String layerId, int segmentIndex, GridExtents extents) {
        StackLayer first = segment.get(0);
        if (segment.size() == 1) {
            return first.copyAs(layerId, segmentIndex);
        }
        StackLayer merged = StackLayer.empty(layerId, first.trackId, first.passDirection, segmentIndex, extents);
        int n = segment.size();
        double[] east = new double[n];
        double[] north = new double[n];
        double[] up = new double[n];
        Set<String> auxiliaryNames = new LinkedHashSet<>();
        for (StackLayer frame : segment) {
            auxiliaryNames.addAll(frame.auxiliary.keySet());
        }
        for (String name : auxiliaryNames) {
            merged.newAuxiliary(name);
        }
        double[] auxiliary = new double[n];
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                double weightedSum = 0;
                double weightSum = 0;
                int contributors = 0;
                double singleVelocity = Double.NaN;
                boolean inFootprint = false;
                for (int i = 0; i < n; i++) {
                    StackLayer frame = segment.get(i);
                    inFootprint |= frame.footprint[x][y];
                    east[i] = frame.east[x][y];
                    north[i] = frame.north[x][y];
                    up[i] = frame.up[x][y];
                    double sigma = frame.uncertainty[x][y];
                    if (frame.isValue(x, y) && sigma > 0 && Double.isFinite(sigma)) {
                        double w = 1 / sigma;
                        weightedSum += frame.velocity[x][y] * w;
                        weightSum += w;
                        contributors += 1;
                        singleVelocity = frame.velocity[x][y];
                    }
                }
                if (!inFootprint) {
                    continue;
                }
                merged.footprint[x][y] = true;
                for (String name : auxiliaryNames) {
                    for (int i = 0; i < n; i++) {
                        double[][] values = segment.get(i).auxiliary.get(name);
                        auxiliary[i] = values == null ? Double.NaN : values[x][y];
                    }
                    merged.auxiliary.get(name)[x][y] = NanStatistics.meanOfFinite(auxiliary);
                }
                if (contributors == 0) {
                    continue;
                }
                merged.velocity[x][y] = contributors == 1 ? singleVelocity : weightedSum / weightSum;
                merged.uncertainty[x][y] = 1 / Math.sqrt(weightSum);
                merged.east[x][y] = NanStatistics.meanOfFinite(east);
                merged.north[x][y] = NanStatistics.meanOfFinite(north);
                merged.up[x][y] = NanStatistics.meanOfFinite(up);
            }
        }
        return merged;
    }

}
