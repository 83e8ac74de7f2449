package com.phillippitts.strokecoach.service.analysis.event;

import com.phillippitts.strokecoach.domain.AnalysisReport;

import java.time.Instant;

/**
 * Emitted when an analysis job finishes with a report.
 *
 * @param jobId job identifier
 * @param report the analysis report
 * @param durationNanos wall time from job start to completion
 * @param timestamp completion time
 */
public record AnalysisCompletedEvent(
        String jobId,
        AnalysisReport report,
        long durationNanos,
        Instant timestamp
) {}
