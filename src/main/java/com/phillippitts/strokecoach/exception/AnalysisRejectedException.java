package com.phillippitts.strokecoach.exception;

/**
 * Thrown when the job pool is saturated and a new analysis cannot be scheduled.
 */
public class AnalysisRejectedException extends StrokeCoachException {

    private final String jobId;

    public AnalysisRejectedException(String jobId, Throwable cause) {
        super("Analysis " + jobId + " rejected: job queue is full", cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
