package com.phillippitts.strokecoach.domain;

import java.util.Locale;

/**
 * The three key moments of a stroke, in temporal order.
 */
public enum Phase {
    PREPARATION("preparation", "Preparation"),
    IMPACT("impact", "Impact"),
    FOLLOW_THROUGH("follow_through", "Follow_through");

    private final String key;
    private final String label;

    Phase(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /** Record name used in keypoint files and JSON payloads. */
    public String key() {
        return key;
    }

    /** Capitalized name used as the feedback line prefix. */
    public String label() {
        return label;
    }

    public static Phase fromKey(String key) {
        String k = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        for (Phase p : values()) {
            if (p.key.equals(k)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + key);
    }
}
