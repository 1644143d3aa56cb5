package com.conveyal.velmap.reference;

/** How the correction surface tying each layer to the reference field is estimated from their residual. */
public enum ReferenceMethod {

    /** No referencing, layers keep their own arbitrary reference. */
    NONE,

    /** Low order polynomial surface fitted by least squares. */
    POLYNOMIAL,

    /** Moving-average filter applied to the residual itself. */
    FILTER

}
