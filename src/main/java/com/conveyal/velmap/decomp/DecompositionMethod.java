package com.conveyal.velmap.decomp;

/**
 * How the North component, to which near-polar orbits are almost blind, is handled when decomposing line-of-sight
 * velocities into East and Up.
 */
public enum DecompositionMethod {

    /** Subtract the reference North velocity projected into each line of sight, then solve for East and Up. */
    REMOVE_NORTH(true),

    /** Solve for East, Up and North, constraining North with the reference North velocity as a prior. */
    ESTIMATE_NORTH(true),

    /** Assume North is zero and solve for East and Up. */
    ZERO_NORTH(false),

    /**
     * Solve for East and a combined North-Up component, then split the latter into North and Up using the mean
     * look geometry of the pixel and the reference North velocity.
     */
    TWO_STAGE(true);

    private final boolean requiresReference;

    DecompositionMethod (boolean requiresReference) {
        this.requiresReference = requiresReference;
    }

    /** Whether a reference North velocity field must be supplied. */
    public boolean requiresReference () {
        return requiresReference;
    }

}
