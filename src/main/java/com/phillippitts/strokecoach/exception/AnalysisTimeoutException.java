package com.phillippitts.strokecoach.exception;

/**
 * Thrown when an analysis exceeds its deadline. Partial phase data is discarded.
 */
public class AnalysisTimeoutException extends StrokeCoachException {

    private final long timeoutMs;

    public AnalysisTimeoutException(String stage, long timeoutMs) {
        super("Analysis timed out during " + stage + " after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
