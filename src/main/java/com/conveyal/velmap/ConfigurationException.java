package com.conveyal.velmap;

/**
 * Thrown when a run cannot proceed at all: missing or contradictory configuration, no usable input frames, or no
 * pixel anywhere observed from more than one look direction. Problems local to one frame, track or pixel are never
 * reported this way, they are recorded as DataQualityWarnings and processing continues.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException (String message) {
        super(message);
    }

    public ConfigurationException (String message, Throwable cause) {
        super(message, cause);
    }

}
