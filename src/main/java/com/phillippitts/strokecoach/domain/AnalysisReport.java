package com.phillippitts.strokecoach.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything produced by one analysis request.
 *
 * @param strokeType analyzed stroke type
 * @param handedness dominant hand used for detection
 * @param frameCount number of decoded frames
 * @param outcomes detector outcome per phase (all three phases present)
 * @param keypoints per-phase keypoint records; a missing phase has no entry
 * @param comparison corpus comparison, possibly the no-reference sentinel
 */
public record AnalysisReport(
        StrokeType strokeType,
        Handedness handedness,
        int frameCount,
        Map<Phase, DetectionOutcome> outcomes,
        Map<Phase, List<Landmark>> keypoints,
        ComparisonResult comparison
) {
    public AnalysisReport {
        EnumMap<Phase, DetectionOutcome> oc = new EnumMap<>(Phase.class);
        oc.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(oc);
        // records of partial poses contain null gaps
        EnumMap<Phase, List<Landmark>> kp = new EnumMap<>(Phase.class);
        keypoints.forEach((phase, list) -> kp.put(phase, Collections.unmodifiableList(new ArrayList<>(list))));
        keypoints = Collections.unmodifiableMap(kp);
    }
}
