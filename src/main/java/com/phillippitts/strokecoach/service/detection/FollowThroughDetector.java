package com.phillippitts.strokecoach.service.detection;

import com.phillippitts.strokecoach.config.properties.PhaseDetectionProperties;
import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.StrokeType;
import com.phillippitts.strokecoach.service.geometry.JointGeometry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Picks the finish position: arm extended, wrist near the stroke's expected end point,
 * movement settled. Searches the second half of the sequence only.
 *
 * <p>Tiers: a stabilized high-scoring frame ({@code biomechanical}), else the highest
 * scoring frame ({@code extension}), else a fixed fraction of the duration
 * ({@code temporal}). Sequences shorter than {@code minFrames} go straight to the
 * midpoint ({@code temporal}).
 */
@Component
public class FollowThroughDetector implements PhaseDetector {

    private static final Logger LOG = LogManager.getLogger(FollowThroughDetector.class);

    private final PhaseDetectionProperties properties;

    public FollowThroughDetector(PhaseDetectionProperties properties) {
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public Phase phase() {
        return Phase.FOLLOW_THROUGH;
    }

    @Override
    public DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness) {
        PhaseDetectionProperties.FollowThrough cfg = properties.getFollowThrough();
        PhaseDetectionProperties.Stroke stroke = properties.forStroke(strokeType);
        int n = frames.size();
        if (n == 0) {
            return DetectionOutcome.notFound(0.0);
        }
        if (n < cfg.getMinFrames()) {
            // too short to have a second half worth searching; take the midpoint
            LOG.debug("Only {} frames; midpoint fallback", n);
            return DetectionOutcome.fallback(n / 2, 0.0, DetectionOutcome.TEMPORAL);
        }

        double targetX = stroke.getFollowThroughTargetX() * handedness.mirror();
        double targetY = stroke.getFollowThroughTargetY();

        double[] scores = new double[n];
        boolean[] scored = new boolean[n];
        double max = Double.NEGATIVE_INFINITY;
        int start = n / 2;
        for (int i = start; i < n; i++) {
            Optional<Pose> pose = frames.pose(i);
            if (pose.isEmpty() || !hasArm(pose.get(), handedness)) {
                continue;
            }
            scores[i] = score(pose.get(), handedness, targetX, targetY, cfg);
            scored[i] = true;
            max = Math.max(max, scores[i]);
        }
        if (max == Double.NEGATIVE_INFINITY) {
            LOG.debug("No pose in the second half of {} frames; temporal fallback", n);
            return temporalFallback(n, cfg);
        }

        double threshold = max * cfg.getThresholdRatio();
        int bestStable = -1;
        int bestAny = -1;
        for (int i = start; i < n; i++) {
            if (!scored[i] || scores[i] < threshold) {
                continue;
            }
            if (bestAny < 0 || scores[i] > scores[bestAny]) {
                bestAny = i;
            }
            if (isStabilized(frames, i, handedness, cfg)
                    && (bestStable < 0 || scores[i] > scores[bestStable])) {
                bestStable = i;
            }
        }

        if (bestStable >= 0) {
            return DetectionOutcome.detected(bestStable, scores[bestStable]);
        }
        if (bestAny >= 0) {
            return DetectionOutcome.fallback(bestAny, scores[bestAny], DetectionOutcome.EXTENSION);
        }
        return temporalFallback(n, cfg);
    }

    /**
     * {@code w * extension + (1 - w) * position} for one frame.
     */
    static double score(Pose pose, Handedness handedness, double targetX, double targetY,
                        PhaseDetectionProperties.FollowThrough cfg) {
        Landmark shoulder = pose.require(handedness.shoulder());
        Landmark elbow = pose.require(handedness.elbow());
        Landmark wrist = pose.require(handedness.wrist());

        double angle = JointGeometry.angleBetween(shoulder, elbow, wrist);
        double extension = Math.max(0.0, Math.min(1.0,
                (angle - cfg.getMinElbowAngle()) / cfg.getElbowAngleRange()));

        double dx = (wrist.x() - shoulder.x()) - targetX;
        double dy = (wrist.y() - shoulder.y()) - targetY;
        double position = Math.max(0.0, 1.0 - Math.hypot(dx, dy));

        double w = cfg.getExtensionWeight();
        return w * extension + (1.0 - w) * position;
    }

    /**
     * True when the frame and the preceding {@code stabilizationFrames} frames all carry
     * the dominant wrist and every consecutive wrist displacement is below the threshold.
     */
    static boolean isStabilized(FrameSequence frames, int index, Handedness handedness,
                                PhaseDetectionProperties.FollowThrough cfg) {
        int history = cfg.getStabilizationFrames();
        if (index < history) {
            return false;
        }
        Landmark previous = null;
        for (int i = index - history; i <= index; i++) {
            Optional<Landmark> wrist = frames.pose(i).flatMap(p -> p.landmark(handedness.wrist()));
            if (wrist.isEmpty()) {
                return false;
            }
            if (previous != null
                    && JointGeometry.distance(previous, wrist.get()) >= cfg.getStabilizationDisplacement()) {
                return false;
            }
            previous = wrist.get();
        }
        return true;
    }

    private static DetectionOutcome temporalFallback(int n, PhaseDetectionProperties.FollowThrough cfg) {
        int frame = Math.min(n - 1, (int) (n * cfg.getTemporalFallbackRatio()));
        return DetectionOutcome.fallback(frame, 0.0, DetectionOutcome.TEMPORAL);
    }

    private static boolean hasArm(Pose pose, Handedness handedness) {
        return pose.has(handedness.shoulder(), handedness.elbow(), handedness.wrist());
    }
}
