package com.conveyal.velmap.merge;

import com.conveyal.velmap.grid.PassDirection;

import java.util.Collections;
import java.util.List;

/**
 * A run of consecutive frames of one track in which every adjacent pair overlaps. A track whose frames all overlap
 * consists of a single segment, otherwise it is split wherever a pair shares no valid pixel.
 */
public class TrackSegment {

    public final String trackId;

    public final PassDirection passDirection;

    /** Position of this segment along its track, starting at zero. */
    public final int segmentIndex;

    /** Frames of this segment in along-track order. */
    public final List<String> frameIds;

    /**
     * Layers of the output stack representing this segment: one merged layer, or the corrected frames themselves
     * when frames are not merged.
     */
    public final List<String> layerIds;

    public TrackSegment (String trackId, PassDirection passDirection, int segmentIndex,
                         List<String> frameIds, List<String> layerIds) {
        this.trackId = trackId;
        this.passDirection = passDirection;
        this.segmentIndex = segmentIndex;
        this.frameIds = Collections.unmodifiableList(frameIds);
        this.layerIds = Collections.unmodifiableList(layerIds);
    }

    @Override
    public String toString () {
        return String.format("Segment %d of track %s: %s", segmentIndex, trackId, frameIds);
    }

}
