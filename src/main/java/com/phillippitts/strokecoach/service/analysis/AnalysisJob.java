package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.domain.AnalysisReport;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.StrokeType;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an analysis job. Status changes produce a new instance.
 *
 * @param report set only when {@code DONE}
 * @param error set only when {@code FAILED}
 */
public record AnalysisJob(
        String id,
        JobStatus status,
        StrokeType strokeType,
        Handedness handedness,
        Instant createdAt,
        Instant updatedAt,
        AnalysisReport report,
        String error
) {
    public AnalysisJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static AnalysisJob queued(String id, StrokeType strokeType, Handedness handedness, Instant now) {
        return new AnalysisJob(id, JobStatus.QUEUED, strokeType, handedness, now, now, null, null);
    }

    public AnalysisJob processing(Instant now) {
        return new AnalysisJob(id, JobStatus.PROCESSING, strokeType, handedness, createdAt, now, null, null);
    }

    public AnalysisJob done(AnalysisReport report, Instant now) {
        return new AnalysisJob(id, JobStatus.DONE, strokeType, handedness, createdAt, now,
                Objects.requireNonNull(report, "report"), null);
    }

    public AnalysisJob failed(String error, Instant now) {
        return new AnalysisJob(id, JobStatus.FAILED, strokeType, handedness, createdAt, now, null, error);
    }

    public boolean isFinished() {
        return status.isFinished();
    }
}
