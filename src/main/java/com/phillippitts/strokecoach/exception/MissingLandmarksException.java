package com.phillippitts.strokecoach.exception;

import java.util.List;

/**
 * Thrown when a landmark set lacks indices an operation requires (for example both
 * shoulders for normalization).
 */
public class MissingLandmarksException extends StrokeCoachException {

    private final List<Integer> missing;

    public MissingLandmarksException(List<Integer> missing) {
        super("Missing required landmarks: " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<Integer> getMissing() {
        return missing;
    }
}
