package com.phillippitts.strokecoach.exception;

/**
 * Thrown when a video cannot be decoded into a pose track (unreadable container,
 * estimator exit failure, or malformed estimator output). Fatal for the request.
 */
public class InvalidVideoException extends StrokeCoachException {

    private final String reason;

    public InvalidVideoException(String reason) {
        super("Invalid video: " + reason);
        this.reason = reason;
    }

    public InvalidVideoException(String reason, Throwable cause) {
        super("Invalid video: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
