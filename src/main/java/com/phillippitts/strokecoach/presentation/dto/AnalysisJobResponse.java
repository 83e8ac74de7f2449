package com.phillippitts.strokecoach.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.strokecoach.domain.AnalysisReport;
import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.service.analysis.AnalysisJob;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Status of an analysis job, with the report once it is done or the error once it failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisJobResponse(
        String jobId,
        String status,
        Instant createdAt,
        Instant updatedAt,
        Report report,
        String error
) {

    public static AnalysisJobResponse from(AnalysisJob job) {
        return new AnalysisJobResponse(job.id(), job.status().name(), job.createdAt(), job.updatedAt(),
                job.report() == null ? null : Report.from(job.report()), job.error());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Report(
            String strokeType,
            String handedness,
            int frameCount,
            Map<String, PhaseView> phases,
            ComparisonResponse comparison
    ) {
        static Report from(AnalysisReport report) {
            Map<String, PhaseView> phases = new LinkedHashMap<>();
            for (Phase phase : Phase.values()) {
                DetectionOutcome outcome = report.outcomes().get(phase);
                List<LandmarkDto> keypoints = report.keypoints().containsKey(phase)
                        ? report.keypoints().get(phase).stream().map(LandmarkDto::from).toList()
                        : null;
                phases.put(phase.key(), new PhaseView(
                        outcome == null ? DetectionOutcome.Kind.NOT_FOUND.name() : outcome.kind().name(),
                        outcome == null || !outcome.isFound() ? null : outcome.frameIndex(),
                        outcome == null ? null : outcome.method(),
                        outcome == null ? null : outcome.score(),
                        keypoints));
            }
            return new Report(report.strokeType().key(), report.handedness().name().toLowerCase(Locale.ROOT),
                    report.frameCount(), phases, ComparisonResponse.from(report.comparison()));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PhaseView(
            String detection,
            Integer frame,
            String method,
            Double score,
            List<LandmarkDto> keypoints
    ) {}
}
