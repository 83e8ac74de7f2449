package com.phillippitts.strokecoach.service.detection;

import com.phillippitts.strokecoach.config.properties.PhaseDetectionProperties;
import com.phillippitts.strokecoach.domain.BodyLandmarks;
import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.StrokeType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

import static com.phillippitts.strokecoach.service.geometry.JointGeometry.angleBetween;
import static com.phillippitts.strokecoach.service.geometry.JointGeometry.closeness;
import static com.phillippitts.strokecoach.service.geometry.JointGeometry.orientation;

/**
 * Finds the take-back frame: dominant elbow near its target angle, shoulders rotated
 * and the wrist at the expected height, inside a stroke-specific window.
 */
@Component
public class PreparationDetector implements PhaseDetector {

    private static final Logger LOG = LogManager.getLogger(PreparationDetector.class);

    private final PhaseDetectionProperties properties;

    public PreparationDetector(PhaseDetectionProperties properties) {
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public Phase phase() {
        return Phase.PREPARATION;
    }

    @Override
    public DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness) {
        PhaseDetectionProperties.Stroke cfg = properties.forStroke(strokeType);
        int n = frames.size();
        int start = (int) Math.floor(n * cfg.getWindowStart());
        int end = Math.min(n - 1, (int) Math.floor(n * cfg.getWindowEnd()));

        double bestScore = -1.0;
        int bestFrame = -1;
        for (int i = start; i <= end; i++) {
            Optional<Pose> pose = frames.pose(i);
            if (pose.isEmpty() || !scorable(pose.get(), handedness)) {
                continue;
            }
            double score = score(pose.get(), cfg, handedness);
            if (score > bestScore) {
                bestScore = score;
                bestFrame = i;
            }
        }

        if (bestFrame < 0 || bestScore < cfg.getMinScore()) {
            LOG.debug("No {} preparation frame in [{}, {}] (best score {}, threshold {})",
                    strokeType.key(), start, end, bestScore, cfg.getMinScore());
            return DetectionOutcome.notFound(Math.max(0.0, bestScore));
        }
        LOG.debug("{} preparation at frame {} (score {})", strokeType.key(), bestFrame, bestScore);
        return DetectionOutcome.detected(bestFrame, bestScore);
    }

    /**
     * Composite score of one frame; see {@link PhaseDetectionProperties.Stroke} for the terms.
     */
    static double score(Pose pose, PhaseDetectionProperties.Stroke cfg, Handedness handedness) {
        Landmark shoulder = pose.require(handedness.shoulder());
        Landmark elbow = pose.require(handedness.elbow());
        Landmark wrist = pose.require(handedness.wrist());

        double elbowAngle = angleBetween(shoulder, elbow, wrist);
        double elbowScore = closeness(elbowAngle, cfg.getTargetElbowAngle(), cfg.getElbowTolerance());

        double tilt = shoulderTilt(pose.require(BodyLandmarks.LEFT_SHOULDER),
                pose.require(BodyLandmarks.RIGHT_SHOULDER));
        double tiltScore = closeness(tilt, cfg.getTargetShoulderTilt(), cfg.getShoulderTiltTolerance());

        double height = wrist.y() - shoulder.y();
        double heightScore = closeness(height, cfg.getTargetWristHeight(), cfg.getWristHeightTolerance());

        return cfg.getElbowWeight() * elbowScore
                + cfg.getShoulderWeight() * tiltScore
                + cfg.getHeightWeight() * heightScore;
    }

    /**
     * Inclination of the shoulder line folded into [0, 90] degrees.
     */
    static double shoulderTilt(Landmark left, Landmark right) {
        double angle = Math.abs(orientation(left, right));
        return angle > 90.0 ? 180.0 - angle : angle;
    }

    private static boolean scorable(Pose pose, Handedness handedness) {
        return pose.has(handedness.shoulder(), handedness.elbow(), handedness.wrist(),
                BodyLandmarks.LEFT_SHOULDER, BodyLandmarks.RIGHT_SHOULDER);
    }
}
