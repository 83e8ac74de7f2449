package com.phillippitts.strokecoach.exception;

public class AnalysisNotFoundException extends StrokeCoachException {

    private final String jobId;

    public AnalysisNotFoundException(String jobId) {
        super("No analysis with id " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
