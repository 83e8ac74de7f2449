package com.phillippitts.strokecoach.domain;

import java.util.Locale;

/**
 * Dominant hand of the player; selects which arm the detectors follow.
 */
public enum Handedness {
    RIGHT(BodyLandmarks.RIGHT_SHOULDER, BodyLandmarks.RIGHT_ELBOW, BodyLandmarks.RIGHT_WRIST),
    LEFT(BodyLandmarks.LEFT_SHOULDER, BodyLandmarks.LEFT_ELBOW, BodyLandmarks.LEFT_WRIST);

    private final int shoulder;
    private final int elbow;
    private final int wrist;

    Handedness(int shoulder, int elbow, int wrist) {
        this.shoulder = shoulder;
        this.elbow = elbow;
        this.wrist = wrist;
    }

    public int shoulder() {
        return shoulder;
    }

    public int elbow() {
        return elbow;
    }

    public int wrist() {
        return wrist;
    }

    /** Sign applied to horizontal target offsets defined for a right-handed player. */
    public double mirror() {
        return this == RIGHT ? 1.0 : -1.0;
    }

    public static Handedness fromKey(String value) {
        if (value == null || value.isBlank()) {
            return RIGHT;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "right" -> RIGHT;
            case "left" -> LEFT;
            default -> throw new IllegalArgumentException("Unknown handedness: " + value);
        };
    }
}
