package com.conveyal.velmap.merge;

import com.conveyal.velmap.grid.GridExtents;
import com.conveyal.velmap.grid.PassDirection;
import com.conveyal.velmap.grid.StackLayer;
import com.conveyal.velmap.grid.VelocityStack;
import com.conveyal.velmap.util.DataQualityReport;
import com.conveyal.velmap.util.NanStatistics;
import gnu.trove.list.array.TDoubleArrayList;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.conveyal.velmap.util.DataQualityWarning.Type.UNORDERED_OVERLAP;

/**
 * Diagnostic alignment of along-track merged tracks across track, for checking the consistency of the velocities
 * without any influence from the reference field. Nothing produced here is used by the decomposition.
 *
 * Each track's line-of-sight velocity is projected into a canonical viewing geometry for its pass direction. Tracks
 * of one pass direction are then ordered west to east by their westernmost valid column and the mean difference
 * over each adjacent overlap is removed from the eastern track, accumulating along the chain. The aligned tracks are
 * averaged into one field per pass direction. When both pass directions are present, the two averages are shifted
 * to zero mean over a shared reference region and decomposed into East and Up assuming the canonical geometry.
 */
public class AcrossTrackMerger {

    private static final Logger LOG = LoggerFactory.getLogger(AcrossTrackMerger.class);

    /** Canonical incidence angle in degrees, shared by both pass directions. */
    public static final double CANONICAL_INCIDENCE = 39;

    /** Canonical azimuth of ascending tracks in degrees, in the convention used by {@link #azimuth}. */
    public static final double CANONICAL_AZIMUTH_ASCENDING = -10;

    public static final double CANONICAL_AZIMUTH_DESCENDING = -170;

    public interface Config {
        /** Bounds of the reference region for the diagnostic decomposition. Zero stands for the grid bound. */
        double acrossTrackRefXMin ();
        double acrossTrackRefXMax ();
        double acrossTrackRefYMin ();
        double acrossTrackRefYMax ();
    }

    public static class Result {

        /** The tracks after projection and offset removal. */
        public final VelocityStack aligned;

        /** Constant offset removed from each track, keyed on layer id, in the order they were removed. */
        public final Map<String, Double> offsets;

        /** Mean aligned line-of-sight velocity per pass direction. Pass directions without tracks are absent. */
        public final Map<PassDirection, double[][]> averageLineOfSight;

        /** Plain mean of each auxiliary layer over the tracks of a pass direction, keyed like averageLineOfSight. */
        public final Map<PassDirection, Map<String, double[][]>> averageAuxiliary;

        /** Diagnostic East and Up components, null unless both pass directions are present. */
        public final double[][] east;

        public final double[][] up;

        public Result (VelocityStack aligned, Map<String, Double> offsets,
                       Map<PassDirection, double[][]> averageLineOfSight,
                       Map<PassDirection, Map<String, double[][]>> averageAuxiliary, double[][] east, double[][] up) {
            this.aligned = aligned;
            this.offsets = Collections.unmodifiableMap(offsets);
            this.averageLineOfSight = Collections.unmodifiableMap(averageLineOfSight);
            this.averageAuxiliary = Collections.unmodifiableMap(averageAuxiliary);
            this.east = east;
            this.up = up;
        }

        public boolean hasDecomposition () {
            return east != null;
        }

    }

    private final Config config;

    public AcrossTrackMerger (Config config) {
        this.config = config;
    }

    public Result merge (VelocityStack mergedTracks, DataQualityReport report) {
        VelocityStack aligned = mergedTracks.copy();
        GridExtents extents = aligned.extents;
        for (StackLayer layer : aligned.getLayers()) {
            projectToCanonicalGeometry(layer);
        }

        Map<String, Double> offsets = new LinkedHashMap<>();
        Map<PassDirection, double[][]> averages = new EnumMap<>(PassDirection.class);
        Map<PassDirection, Map<String, double[][]>> auxiliaryAverages = new EnumMap<>(PassDirection.class);
        for (PassDirection pass : PassDirection.values()) {
            List<StackLayer> tracks = new ArrayList<>(aligned.layersFor(pass));
            if (tracks.isEmpty()) {
                continue;
            }
            tracks.sort(Comparator.comparingDouble(StackLayer::minValidX).thenComparing(l -> l.id));
            for (int k = 1; k < tracks.size(); k++) {
                StackLayer west = tracks.get(k - 1);
                StackLayer east = tracks.get(k);
                double offset = meanDifference(west, east);
                if (Double.isNaN(offset)) {
                    report.warn(UNORDERED_OVERLAP, east.id, String.format(
                            "No overlap with %s, which precedes it in across-track order. Offset not removed.",
                            west.id));
                    continue;
                }
                subtract(east, offset);
                offsets.put(east.id, offset);
            }
            averages.put(pass, average(tracks, extents));
            auxiliaryAverages.put(pass, averageAuxiliary(tracks, extents));
        }

        double[][] east = null;
        double[][] up = null;
        if (averages.size() == PassDirection.values().length) {
            double[][] ascending = averages.get(PassDirection.ASCENDING);
            double[][] descending = averages.get(PassDirection.DESCENDING);
            shiftToReferenceRegion(ascending, extents);
            shiftToReferenceRegion(descending, extents);
            RealMatrix inverse = new LUDecomposition(canonicalDesignMatrix()).getSolver().getInverse();
            east = extents.newArray(Double.NaN);
            up = extents.newArray(Double.NaN);
            for (int x = 0; x < extents.width; x++) {
                for (int y = 0; y < extents.height; y++) {
                    double a = ascending[x][y];
                    double d = descending[x][y];
                    if (Double.isFinite(a) && Double.isFinite(d)) {
                        east[x][y] = inverse.getEntry(0, 0) * a + inverse.getEntry(0, 1) * d;
                        up[x][y] = inverse.getEntry(1, 0) * a + inverse.getEntry(1, 1) * d;
                    }
                }
            }
        } else {
            LOG.info("Only one pass direction present, skipping diagnostic East/Up decomposition.");
        }
        return new Result(aligned, offsets, averages, auxiliaryAverages, east, up);
    }

    /** Incidence angle in degrees from the Up direction cosine. */
    public static double incidence (double up) {
        return FastMath.toDegrees(FastMath.acos(up));
    }

    /** Azimuth in degrees from the East direction cosine and the incidence angle. */
    public static double azimuth (double east, double incidence) {
        double cosine = east / FastMath.sin(FastMath.toRadians(incidence));
        cosine = FastMath.max(-1, FastMath.min(1, cosine));
        return FastMath.toDegrees(FastMath.acos(cosine)) - 180;
    }

    /**
     * Scale every valid velocity by the cosine projection factor between its own viewing geometry and the canonical
     * geometry of its pass direction.
     */
    static void projectToCanonicalGeometry (StackLayer layer) {
        double canonicalAzimuth = layer.passDirection == PassDirection.ASCENDING
                ? CANONICAL_AZIMUTH_ASCENDING : CANONICAL_AZIMUTH_DESCENDING;
        GridExtents extents = layer.extents;
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (!layer.isValue(x, y)) continue;
                double inc = incidence(layer.up[x][y]);
                double az = azimuth(layer.east[x][y], inc);
                double factor = FastMath.cos(FastMath.toRadians(canonicalAzimuth - az))
                        * FastMath.cos(FastMath.toRadians(CANONICAL_INCIDENCE - inc));
                layer.velocity[x][y] *= factor;
            }
        }
    }

    /** Mean of later minus earlier over cells valid in both, NaN if there are none. */
    private static double meanDifference (StackLayer earlier, StackLayer later) {
        TDoubleArrayList differences = new TDoubleArrayList();
        GridExtents extents = earlier.extents;
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                if (earlier.isValue(x, y) && later.isValue(x, y)) {
                    differences.add(later.velocity[x][y] - earlier.velocity[x][y]);
                }
            }
        }
        return NanStatistics.mean(differences.toArray());
    }

    private static void subtract (StackLayer layer, double offset) {
        for (int x = 0; x < layer.extents.width; x++) {
            for (int y = 0; y < layer.extents.height; y++) {
                if (layer.isValue(x, y)) {
                    layer.velocity[x][y] -= offset;
                }
            }
        }
    }

    private static double[][] average (List<StackLayer> tracks, GridExtents extents) {
        double[][] result = extents.newArray(Double.NaN);
        double[] values = new double[tracks.size()];
        for (int x = 0; x < extents.width; x++) {
            for (int y = 0; y < extents.height; y++) {
                for (int i = 0; i < values.length; i++) {
                    StackLayer track = tracks.get(i);
                    values[i] = track.isValue(x, y) ? track.velocity[x][y] : Double.NaN;
                }
                result[x][y] = NanStatistics.meanOfFinite(values);
            }
        }
        return result;
    }

    /** Mean of every auxiliary layer over the tracks carrying it, wherever any of them has a finite value. */
    private static Map<String, double[][]> averageAuxiliary (List<StackLayer> tracks, GridExtents extents) {
        Set<String> names = new LinkedHashSet<>();
        for (StackLayer track : tracks) {
            names.addAll(track.auxiliary.keySet());
        }
        Map<String, double[][]> result = new LinkedHashMap<>();
        double[] values = new double[tracks.size()];
        for (String name : names) {
            double[][] average = extents.newArray(Double.NaN);
            for (int x = 0; x < extents.width; x++) {
                for (int y = 0; y < extents.height; y++) {
                    for (int i = 0; i < values.length; i++) {
                        double[][] layer = tracks.get(i).auxiliary.get(name);
                        values[i] = layer == null ? Double.NaN : layer[x][y];
                    }
                    average[x][y] = NanStatistics.meanOfFinite(values);
                }
            }
            result.put(name, average);
        }
        return result;
    }

    /** Subtract the mean over the reference region from the whole field, if the region holds any data. */
    private void shiftToReferenceRegion (double[][] field, GridExtents extents) {
        int x0 = extents.nearestColumn(orDefault(config.acrossTrackRefXMin(), extents.west));
        int x1 = extents.nearestColumn(orDefault(config.acrossTrackRefXMax(), extents.east()));
        int y0 = extents.nearestRow(orDefault(config.acrossTrackRefYMin(), extents.south));
        int y1 = extents.nearestRow(orDefault(config.acrossTrackRefYMax(), extents.north()));
        TDoubleArrayList values = new TDoubleArrayList();
        for (int x = Math.min(x0, x1); x <= Math.max(x0, x1); x++) {
            for (int y = Math.min(y0, y1); y <= Math.max(y0, y1); y++) {
                values.add(field[x][y]);
            }
        }
        double shift = NanStatistics.mean(values.toArray());
        if (Double.isNaN(shift)) {
            LOG.warn("Across-track reference region contains no data, average field left unshifted.");
            return;
        }
        for (double[] column : field) {
            for (int y = 0; y < column.length; y++) {
                column[y] -= shift;
            }
        }
    }

    private static double orDefault (double bound, double gridBound) {
        return bound == 0 ? gridBound : bound;
    }

    /** Rows give the East and Up sensitivity of the canonical ascending and descending line of sight. */
    static RealMatrix canonicalDesignMatrix () {
        double sinInc = FastMath.sin(FastMath.toRadians(CANONICAL_INCIDENCE));
        double cosInc = FastMath.cos(FastMath.toRadians(CANONICAL_INCIDENCE));
        return new Array2DRowRealMatrix(new double[][] {
                {sinInc * -FastMath.cos(FastMath.toRadians(CANONICAL_AZIMUTH_ASCENDING)), cosInc},
                {sinInc * -FastMath.cos(FastMath.toRadians(CANONICAL_AZIMUTH_DESCENDING)), cosInc}
        });
    }

}
