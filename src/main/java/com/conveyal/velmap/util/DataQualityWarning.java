package com.conveyal.velmap.util;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single non-fatal problem found while processing one frame, track, track pair or set of pixels. The unit named by
 * the subject is skipped or split, and the rest of the run carries on. These are collected in a DataQualityReport
 * and can be written out as JSON alongside the results.
 */
public class DataQualityWarning {

    public enum Type {
        /** A frame or track layer has no valid pixel left after masking, and is dropped or skipped. */
        EMPTY_LAYER,
        /** Two frames adjacent along a track share no valid pixel, so the track is split into segments. */
        NO_OVERLAP,
        /** Two tracks adjacent across-track share no valid pixel, so no offset is removed between them. */
        UNORDERED_OVERLAP,
        /** Some per-pixel decomposition systems could not be solved and were left as no-data. */
        SINGULAR_PIXELS,
        /** A referencing surface could not be fitted to a layer, which is left unreferenced. */
        DEGENERATE_FIT
    }

    public final Type type;

    /** Identifier of the frame, track or segment concerned, or a short description of a group of pixels. */
    public final String subject;

    public final String message;

    public DataQualityWarning (Type type, String subject, String message) {
        this.type = checkNotNull(type);
        this.subject = checkNotNull(subject);
        this.message = checkNotNull(message);
    }

    @Override
    public String toString () {
        return String.format("%s [%s]: %s", type, subject, message);
    }

}
