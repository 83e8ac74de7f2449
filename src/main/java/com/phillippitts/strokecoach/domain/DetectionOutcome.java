package com.phillippitts.strokecoach.domain;

import java.util.OptionalInt;

/**
 * Tagged result of a phase detector.
 *
 * <p>Detectors degrade through ordered tiers instead of throwing: a biomechanical
 * detection, then one or more fallback heuristics, then {@link Kind#NOT_FOUND}.
 *
 * @param kind which tier produced the frame
 * @param frameIndex selected frame, or -1 for {@link Kind#NOT_FOUND}
 * @param score composite score of the selected frame (0 when the tier is not score based)
 * @param method short label of the heuristic ({@code biomechanical}, {@code extension}, {@code temporal})
 */
public record DetectionOutcome(Kind kind, int frameIndex, double score, String method) {

    public enum Kind { DETECTED, FALLBACK, NOT_FOUND }

    public static final String BIOMECHANICAL = "biomechanical";
    public static final String EXTENSION = "extension";
    public static final String TEMPORAL = "temporal";

    public DetectionOutcome {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (kind != Kind.NOT_FOUND && frameIndex < 0) {
            throw new IllegalArgumentException("frameIndex must be >= 0 for " + kind);
        }
    }

    public static DetectionOutcome detected(int frame, double score) {
        return new DetectionOutcome(Kind.DETECTED, frame, score, BIOMECHANICAL);
    }

    public static DetectionOutcome fallback(int frame, double score, String method) {
        return new DetectionOutcome(Kind.FALLBACK, frame, score, method);
    }

    public static DetectionOutcome notFound(double bestScore) {
        return new DetectionOutcome(Kind.NOT_FOUND, -1, bestScore, "none");
    }

    public boolean isFound() {
        return kind != Kind.NOT_FOUND;
    }

    public OptionalInt frame() {
        return isFound() ? OptionalInt.of(frameIndex) : OptionalInt.empty();
    }
}
