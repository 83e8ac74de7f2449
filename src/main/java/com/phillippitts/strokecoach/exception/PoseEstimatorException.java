package com.phillippitts.strokecoach.exception;

/**
 * Thrown when the external pose estimator cannot be run at all (binary missing,
 * process cannot start). Distinct from {@link InvalidVideoException}, which blames the input.
 */
public class PoseEstimatorException extends StrokeCoachException {

    private final String estimator;

    public PoseEstimatorException(String message) {
        super(message);
        this.estimator = "unknown";
    }

    public PoseEstimatorException(String message, String estimator) {
        super(message + " (estimator: " + estimator + ")");
        this.estimator = estimator;
    }

    public PoseEstimatorException(String message, String estimator, Throwable cause) {
        super(message + " (estimator: " + estimator + ")", cause);
        this.estimator = estimator;
    }

    public String getEstimator() {
        return estimator;
    }
}
