package com.phillippitts.strokecoach.exception;

/**
 * Base exception for all stroke-coach application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StrokeCoachException extends RuntimeException {

    public StrokeCoachException(String message) {
        super(message);
    }

    public StrokeCoachException(String message, Throwable cause) {
        super(message, cause);
    }

    public StrokeCoachException(Throwable cause) {
        super(cause);
    }
}
