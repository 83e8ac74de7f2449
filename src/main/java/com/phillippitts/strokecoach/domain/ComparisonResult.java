package com.phillippitts.strokecoach.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of comparing a user sample against the reference corpus.
 *
 * <p>When no corpus entry qualifies, {@link #matchedReferenceId()} is null and
 * {@link #totalDistance()} is {@link Double#POSITIVE_INFINITY}; see {@link #isMatched()}.
 *
 * @param matchedReferenceId id of the best-matching entry ({@code player_id/stroke_type}), or null
 * @param playerId player of the best-matching entry, or null
 * @param totalDistance sum of the three phase distances of the best match
 * @param phaseFeedback one feedback line per phase, in phase order
 * @param referenceClip asset path of the matched reference clip, or null when unmapped
 */
public record ComparisonResult(
        String matchedReferenceId,
        String playerId,
        double totalDistance,
        Map<Phase, String> phaseFeedback,
        String referenceClip
) {

    public static final String NO_REFERENCE_MESSAGE = "No reference videos found for comparison.";

    public ComparisonResult {
        EnumMap<Phase, String> copy = new EnumMap<>(Phase.class);
        if (phaseFeedback != null) {
            copy.putAll(phaseFeedback);
        }
        phaseFeedback = Collections.unmodifiableMap(copy);
    }

    /**
     * Sentinel returned when no reference entry could be compared.
     *
     * @param missingPhaseFeedback explanatory lines for phases the user sample lacks (may be empty)
     */
    public static ComparisonResult noReference(Map<Phase, String> missingPhaseFeedback) {
        return new ComparisonResult(null, null, Double.POSITIVE_INFINITY, missingPhaseFeedback, null);
    }

    public boolean isMatched() {
        return matchedReferenceId != null;
    }

    public Optional<String> clip() {
        return Optional.ofNullable(referenceClip);
    }

    /**
     * Newline-joined feedback. The sentinel leads with {@link #NO_REFERENCE_MESSAGE}.
     */
    public String feedbackText() {
        String lines = phaseFeedback.values().stream().collect(Collectors.joining("\n"));
        if (isMatched()) {
            return lines;
        }
        return lines.isEmpty() ? NO_REFERENCE_MESSAGE : NO_REFERENCE_MESSAGE + "\n" + lines;
    }
}
