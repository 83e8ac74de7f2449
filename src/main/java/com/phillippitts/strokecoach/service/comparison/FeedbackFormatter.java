package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.Phase;

import java.util.Locale;

/**
 * Renders per-phase feedback lines.
 */
public final class FeedbackFormatter {

    static final String IMPACT_MISSING =
            "Could not detect your impact frame. Please try uploading a different video with clearer contact point.";

    private FeedbackFormatter() {
    }

    /**
     * {@code "<Phase>: <tier> (DTW=<d>)."} followed by any deviation messages.
     */
    public static String line(PhaseComparison comparison) {
        StringBuilder sb = new StringBuilder()
                .append(comparison.phase().label())
                .append(": ")
                .append(comparison.tier().description())
                .append(String.format(Locale.ROOT, " (DTW=%.1f).", comparison.distance()));
        for (String deviation : comparison.deviations()) {
            sb.append(' ').append(deviation);
        }
        return sb.toString();
    }

    /**
     * Line for a phase the user sample lacks.
     */
    public static String missingUserPhase(Phase phase) {
        if (phase == Phase.IMPACT) {
            return phase.label() + ": " + IMPACT_MISSING;
        }
        return phase.label() + ": Data missing (user).";
    }
}
