package com.phillippitts.strokecoach.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.strokecoach.domain.ComparisonResult;

/**
 * Wire form of a {@link ComparisonResult}. Reference fields are omitted when nothing matched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonResponse(
        String feedback,
        @JsonProperty("matched_reference_id") String matchedReferenceId,
        @JsonProperty("reference_clip") String referenceClip,
        @JsonProperty("total_distance") Double totalDistance
) {
    public static ComparisonResponse from(ComparisonResult result) {
        return new ComparisonResponse(
                result.feedbackText(),
                result.matchedReferenceId(),
                result.referenceClip(),
                result.isMatched() ? result.totalDistance() : null);
    }
}
