package com.phillippitts.strokecoach.service.analysis.event;

import com.phillippitts.strokecoach.domain.StrokeType;

import java.time.Instant;

/**
 * Emitted when an analysis job fails.
 *
 * @param jobId job identifier
 * @param strokeType requested stroke type
 * @param reason short machine-readable reason ({@code invalid_video}, {@code timeout},
 *               {@code estimator_unavailable}, {@code error})
 * @param message user-facing failure message
 * @param durationNanos wall time from job start to failure
 * @param timestamp failure time
 */
public record AnalysisFailedEvent(
        String jobId,
        StrokeType strokeType,
        String reason,
        String message,
        long durationNanos,
        Instant timestamp
) {}
