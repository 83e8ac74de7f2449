package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.domain.ComparisonResult;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.StrokeSample;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.service.metrics.AnalysisMetrics;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for comparing per-phase keypoint records against the corpus.
 */
@Service
public class ComparisonService {

    private final ReferenceMatcher matcher;
    private final AnalysisMetrics metrics;

    public ComparisonService(ReferenceMatcher matcher, AnalysisMetrics metrics) {
        this.matcher = Objects.requireNonNull(matcher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * @param userRecords landmark list per phase (list position = landmark index); an absent
     *                    or empty list means the phase was not detected
     */
    public ComparisonResult compare(Map<Phase, List<Landmark>> userRecords, StrokeType strokeType) {
        Map<Phase, Pose> poses = new EnumMap<>(Phase.class);
        userRecords.forEach((phase, record) -> {
            if (record != null && !record.isEmpty()) {
                poses.put(phase, Pose.of(record));
            }
        });
        return compare(StrokeSample.of(poses), strokeType);
    }

    public ComparisonResult compare(StrokeSample user, StrokeType strokeType) {
        Objects.requireNonNull(strokeType, "strokeType");
        ComparisonResult result = matcher.match(user, strokeType);
        metrics.recordComparison(strokeType.key(), result.isMatched());
        return result;
    }
}
