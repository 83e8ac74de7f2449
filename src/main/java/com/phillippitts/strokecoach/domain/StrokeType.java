package com.phillippitts.strokecoach.domain;

import java.util.Locale;

public enum StrokeType {
    FOREHAND,
    BACKHAND,
    SERVE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code forehand|backhand|serve} case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static StrokeType fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stroke type must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown stroke type: " + value, e);
        }
    }
}
