package com.phillippitts.strokecoach.service.analysis;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    DONE,
    FAILED;

    public boolean isFinished() {
        return this == DONE || this == FAILED;
    }
}
