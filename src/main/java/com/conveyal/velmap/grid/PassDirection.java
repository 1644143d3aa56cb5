package com.conveyal.velmap.grid;

/** Direction of the satellite pass during acquisition, which fixes the approximate look direction. */
public enum PassDirection {

    ASCENDING('A'), DESCENDING('D');

    /** The letter used for this pass direction in frame identifiers such as 073A_05040_131313. */
    public final char code;

    PassDirection (char code) {
        this.code = code;
    }

    public static PassDirection forCode (char code) {
        for (PassDirection direction : values()) {
            if (direction.code == Character.toUpperCase(code)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown pass direction code: " + code);
    }

}
