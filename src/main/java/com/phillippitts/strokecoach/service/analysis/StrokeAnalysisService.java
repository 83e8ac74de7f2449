package com.phillippitts.strokecoach.service.analysis;

import com.phillippitts.strokecoach.domain.AnalysisReport;
import com.phillippitts.strokecoach.domain.ComparisonResult;
import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.StrokeSample;
import com.phillippitts.strokecoach.service.comparison.ComparisonService;
import com.phillippitts.strokecoach.service.detection.PhaseDetectionService;
import com.phillippitts.strokecoach.service.metrics.AnalysisMetrics;
import com.phillippitts.strokecoach.service.pose.PoseSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Full analysis of one video: pose track, phase detection, per-phase keypoint records,
 * corpus comparison.
 *
 * <p>The deadline in {@link AnalysisContext} is checked between stages and bounds the
 * detector fan-out.
 */
@Service
public class StrokeAnalysisService {

    private static final Logger LOG = LogManager.getLogger(StrokeAnalysisService.class);

    private final PoseSource poseSource;
    private final PhaseDetectionService detectionService;
    private final ComparisonService comparisonService;
    private final AnalysisMetrics metrics;

    public StrokeAnalysisService(PoseSource poseSource,
                                 PhaseDetectionService detectionService,
                                 ComparisonService comparisonService,
                                 AnalysisMetrics metrics) {
        this.poseSource = Objects.requireNonNull(poseSource);
        this.detectionService = Objects.requireNonNull(detectionService);
        this.comparisonService = Objects.requireNonNull(comparisonService);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * @throws com.phillippitts.strokecoach.exception.InvalidVideoException if the video cannot be decoded
     * @throws com.phillippitts.strokecoach.exception.AnalysisTimeoutException if the deadline passes
     */
    public AnalysisReport analyze(AnalysisContext ctx, Path video) {
        FrameSequence frames = poseSource.estimate(video);
        ctx.checkDeadline("pose estimation");

        Map<Phase, DetectionOutcome> outcomes = detectionService.detectAll(
                frames, ctx.strokeType(), ctx.handedness(), ctx.remaining());
        outcomes.forEach(metrics::recordPhaseOutcome);

        Map<Phase, Pose> selected = selectPoses(frames, outcomes);
        ctx.checkDeadline("phase detection");

        ComparisonResult comparison = comparisonService.compare(StrokeSample.of(selected), ctx.strokeType());
        ctx.checkDeadline("comparison");

        Map<Phase, List<Landmark>> keypoints = new EnumMap<>(Phase.class);
        selected.forEach((phase, pose) -> keypoints.put(phase, pose.toList()));
        LOG.info("Analysis {} finished: phases={}, matched={}", ctx.jobId(), keypoints.keySet(),
                comparison.isMatched() ? comparison.matchedReferenceId() : "none");
        return new AnalysisReport(ctx.strokeType(), ctx.handedness(), frames.size(), outcomes, keypoints, comparison);
    }

    /**
     * Pose of each found phase. A fallback frame without a pose leaves the phase absent.
     */
    static Map<Phase, Pose> selectPoses(FrameSequence frames, Map<Phase, DetectionOutcome> outcomes) {
        Map<Phase, Pose> selected = new EnumMap<>(Phase.class);
        outcomes.forEach((phase, outcome) -> {
            if (!outcome.isFound()) {
                return;
            }
            Optional<Pose> pose = frames.pose(outcome.frameIndex());
            if (pose.isPresent()) {
                selected.put(phase, pose.get());
            } else {
                LOG.debug("{} frame {} has no pose; phase treated as missing", phase.key(), outcome.frameIndex());
            }
        });
        return selected;
    }
}
