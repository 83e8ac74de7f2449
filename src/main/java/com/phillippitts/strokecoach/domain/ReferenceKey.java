package com.phillippitts.strokecoach.domain;

import java.util.Objects;

/**
 * Identifies one reference sample in the corpus.
 */
public record ReferenceKey(String playerId, StrokeType strokeType) implements Comparable<ReferenceKey> {

    public ReferenceKey {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(strokeType, "strokeType");
        if (playerId.isBlank()) {
            throw new IllegalArgumentException("playerId must not be blank");
        }
    }

    /** Stable identifier, {@code player_id/stroke_type}. */
    public String id() {
        return playerId + "/" + strokeType.key();
    }

    @Override
    public int compareTo(ReferenceKey o) {
        int c = playerId.compareTo(o.playerId);
        return c != 0 ? c : strokeType.compareTo(o.strokeType);
    }
}
