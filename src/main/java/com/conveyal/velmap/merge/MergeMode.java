package com.conveyal.velmap.merge;

/** What the along-track stage does with the frames of each track. */
public enum MergeMode {

    /** Leave frames untouched, one layer per frame. */
    NONE,

    /** Remove offsets between adjacent frames but keep one layer per frame. */
    CORRECT,

    /** Remove offsets between adjacent frames, then combine each continuous segment of a track into one layer. */
    MERGE

}
