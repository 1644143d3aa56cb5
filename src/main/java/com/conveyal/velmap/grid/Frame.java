package com.conveyal.velmap.grid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One acquisition's line-of-sight velocity field with its uncertainty, the three direction cosines of the look
 * vector (East, North, Up) and an optional validity mask, each on its native lattice. Frames are immutable inputs:
 * operations that resample or aggregate them return new instances.
 *
 * The velocity and uncertainty layers must share a lattice. The three unit vector layers must share a lattice with
 * one another, which may be coarser than the velocity lattice. The mask is interpolated on its own lattice.
 *
 * Auxiliary scalar layers (e.g. terrain height) ride along with the frame under a name. Each one is interpolated on
 * its own lattice and carried through unification and merging, but plays no part in any estimate.
 */
public class Frame {

    /** Number of leading characters of a frame identifier that name its track, e.g. "073A" in 073A_05040_131313. */
    public static final int TRACK_ID_LENGTH = 4;

    public final String id;

    public final String trackId;

    public final PassDirection passDirection;

    public final RasterLayer velocity;

    public final RasterLayer uncertainty;

    public final RasterLayer east;

    public final RasterLayer north;

    public final RasterLayer up;

    /** Nonzero (at least 0.5 after interpolation) where the velocity is valid, or null if no mask was supplied. */
    public final RasterLayer mask;

    /** Auxiliary layers by name, in insertion order. Never null. */
    public final Map<String, RasterLayer> auxiliary;

    public Frame (String id, String trackId, PassDirection passDirection, RasterLayer velocity, RasterLayer uncertainty,
                  RasterLayer east, RasterLayer north, RasterLayer up, RasterLayer mask) {
        this(id, trackId, passDirection, velocity, uncertainty, east, north, up, mask, Collections.emptyMap());
    }

    public Frame (String id, String trackId, PassDirection passDirection, RasterLayer velocity, RasterLayer uncertainty,
                  RasterLayer east, RasterLayer north, RasterLayer up, RasterLayer mask,
                  Map<String, RasterLayer> auxiliary) {
        this.id = checkNotNull(id);
        this.trackId = checkNotNull(trackId);
        this.passDirection = checkNotNull(passDirection);
        this.velocity = checkNotNull(velocity);
        this.uncertainty = checkNotNull(uncertainty);
        this.east = checkNotNull(east);
        this.north = checkNotNull(north);
        this.up = checkNotNull(up);
        this.mask = mask;
        this.auxiliary = Collections.unmodifiableMap(new LinkedHashMap<>(checkNotNull(auxiliary)));
        checkArgument(velocity.hasSameLattice(uncertainty),
                "Velocity and uncertainty of frame %s must share a lattice.", id);
        checkArgument(east.hasSameLattice(north) && east.hasSameLattice(up),
                "Unit vector layers of frame %s must share a lattice.", id);
    }

    /**
     * Create a frame whose track and pass direction are derived from a frame identifier: the track is the fixed-length
     * prefix and its last character is the pass direction letter.
     */
    public static Frame forFrameId (String id, RasterLayer velocity, RasterLayer uncertainty, RasterLayer east,
                                    RasterLayer north, RasterLayer up, RasterLayer mask) {
        return new Frame(id, trackIdOf(id), passDirectionOf(id), velocity, uncertainty, east, north, up, mask);
    }

    public static String trackIdOf (String frameId) {
        checkArgument(frameId.length() >= TRACK_ID_LENGTH, "Frame identifier '%s' is too short to name a track.", frameId);
        return frameId.substring(0, TRACK_ID_LENGTH);
    }

    public static PassDirection passDirectionOf (String frameId) {
        return PassDirection.forCode(trackIdOf(frameId).charAt(TRACK_ID_LENGTH - 1));
    }

    public boolean hasMask () {
        return mask != null;
    }

    /** A copy of this frame carrying one more auxiliary layer, replacing any existing layer of the same name. */
    public Frame withAuxiliary (String name, RasterLayer layer) {
        Map<String, RasterLayer> layers = new LinkedHashMap<>(auxiliary);
        layers.put(checkNotNull(name), checkNotNull(layer));
        return new Frame(id, trackId, passDirection, velocity, uncertainty, east, north, up, mask, layers);
    }

    /**
     * Unit vector layers are sometimes delivered at a finer sampling than the velocities. The aggregation factor is
     * the ratio of their row counts, rounded. When it exceeds one the unit vectors are block-averaged to bring them to
     * the velocity sampling, otherwise this frame is returned unchanged.
     */
    public Frame withUnitVectorsAggregated () {
        int factor = unitVectorAggregationFactor();
        if (factor <= 1) {
            return this;
        }
        return new Frame(id, trackId, passDirection, velocity, uncertainty,
                east.downsample(factor, DownsampleMethod.MEAN),
                north.downsample(factor, DownsampleMethod.MEAN),
                up.downsample(factor, DownsampleMethod.MEAN),
                mask, auxiliary);
    }

    public int unitVectorAggregationFactor () {
        return (int) Math.round((double) east.height() / velocity.height());
    }

    /** Downsample every layer of this frame by the same integer factor. */
    public Frame downsample (int factor, DownsampleMethod method) {
        if (factor <= 1) {
            return this;
        }
        return new Frame(id, trackId, passDirection,
                velocity.downsample(factor, method),
                uncertainty.downsample(factor, method),
                east.downsample(factor, method),
                north.downsample(factor, method),
                up.downsample(factor, method),
                mask == null ? null : mask.downsample(factor, method),
                downsampleAuxiliary(factor, method));
    }

    private Map<String, RasterLayer> downsampleAuxiliary (int factor, DownsampleMethod method) {
        Map<String, RasterLayer> layers = new LinkedHashMap<>();
        for (Map.Entry<String, RasterLayer> entry : auxiliary.entrySet()) {
            layers.put(entry.getKey(), entry.getValue().downsample(factor, method));
        }
        return layers;
    }

    @Override
    public String toString () {
        return String.format("Frame %s (track %s, %s)", id, trackId, passDirection);
    }

}
