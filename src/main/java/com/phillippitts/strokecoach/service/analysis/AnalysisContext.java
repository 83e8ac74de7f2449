package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.exception.AnalysisTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-request parameters threaded explicitly through the pipeline.
 *
 * @param jobId job identifier, also used as logging correlation id
 * @param strokeType stroke being analyzed
 * @param handedness dominant hand of the player
 * @param deadline instant after which the analysis is abandoned
 * @param budget total time allowed, used in timeout messages
 * @param clock time source
 */
public record AnalysisContext(
        String jobId,
        StrokeType strokeType,
        Handedness handedness,
        Instant deadline,
        Duration budget,
        Clock clock
) {
    public AnalysisContext {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(strokeType, "strokeType");
        Objects.requireNonNull(handedness, "handedness");
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(budget, "budget");
        Objects.requireNonNull(clock, "clock");
    }

    public static AnalysisContext start(String jobId, StrokeType strokeType, Handedness handedness,
                                        Duration budget, Clock clock) {
        return new AnalysisContext(jobId, strokeType, handedness, clock.instant().plus(budget), budget, clock);
    }

    /** Time left before the deadline, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * @throws AnalysisTimeoutException if the deadline has passed
     */
    public void checkDeadline(String stage) {
        if (isExpired()) {
            throw new AnalysisTimeoutException(stage, budget.toMillis());
        }
    }
}
