package com.phillippitts.strokecoach.domain;

/**
 * Coarse classification of a phase's alignment distance, used for feedback text.
 */
public enum SimilarityTier {
    EXCELLENT("Excellent similarity"),
    MODERATE("Moderate difference"),
    HIGH("High difference");

    private final String description;

    SimilarityTier(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
