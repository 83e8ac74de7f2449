package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.SimilarityTier;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Result of aligning one phase of a user sample against one phase of a reference.
 *
 * @param phase compared phase
 * @param distance DTW distance over the compared joints
 * @param leftElbowDelta absolute left elbow angle difference, empty when a side lacks the arm
 * @param rightElbowDelta absolute right elbow angle difference, empty when a side lacks the arm
 * @param deviations human readable deviation messages, in left-then-right order
 * @param tier similarity tier of {@code distance}
 */
public record PhaseComparison(
        Phase phase,
        double distance,
        OptionalDouble leftElbowDelta,
        OptionalDouble rightElbowDelta,
        List<String> deviations,
        SimilarityTier tier
) {
    public PhaseComparison {
        deviations = List.copyOf(deviations);
    }
}
