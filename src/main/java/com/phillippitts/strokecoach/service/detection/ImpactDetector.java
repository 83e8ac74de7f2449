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
import com.phillippitts.strokecoach.service.geometry.SignalMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates ball contact as the sharpest change in angular velocity of the dominant arm.
 *
 * <p>Elbow angle and forearm orientation are smoothed, differentiated twice and
 * blended; the peak inside the middle half of the swing is taken as contact. The chosen
 * frame is then snapped to the earliest frame with a complete pose within a small
 * window around it. Short or
 * unusable sequences fall back to the frame of maximum arm extension.
 */
@Component
public class ImpactDetector implements PhaseDetector {

    private static final Logger LOG = LogManager.getLogger(ImpactDetector.class);

    private final PhaseDetectionProperties properties;

    public ImpactDetector(PhaseDetectionProperties properties) {
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public Phase phase() {
        return Phase.IMPACT;
    }

    @Override
    public DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness) {
        PhaseDetectionProperties.Impact cfg = properties.getImpact();

        List<Integer> valid = new ArrayList<>();
        for (int i = 0; i < frames.size(); i++) {
            Optional<Pose> pose = frames.pose(i);
            if (pose.isPresent() && pose.get().has(handedness.shoulder(), handedness.elbow(), handedness.wrist())) {
                valid.add(i);
            }
        }
        if (valid.isEmpty()) {
            return DetectionOutcome.notFound(0.0);
        }
        if (valid.size() < cfg.getMinValidFrames()) {
            LOG.debug("Only {} frames with a pose; using maximum extension", valid.size());
            return extensionFallback(frames, handedness);
        }

        double[] elbow = new double[valid.size()];
        double[] forearm = new double[valid.size()];
        for (int k = 0; k < valid.size(); k++) {
            Pose pose = frames.pose(valid.get(k)).orElseThrow();
            Landmark s = pose.require(handedness.shoulder());
            Landmark e = pose.require(handedness.elbow());
            Landmark w = pose.require(handedness.wrist());
            elbow[k] = JointGeometry.angleBetween(s, e, w);
            forearm[k] = JointGeometry.orientation(e, w);
        }

        double fps = frames.fps();
        double[] elbowVelocity = SignalMath.angularVelocity(
                SignalMath.movingAverage(elbow, cfg.getSmoothingWindow()), fps);
        double[] forearmVelocity = SignalMath.angularVelocity(
                SignalMath.movingAverage(forearm, cfg.getSmoothingWindow()), fps);

        double forearmWeight = properties.forStroke(strokeType).getForearmWeight();
        double[] blended = blend(SignalMath.absoluteDifferences(elbowVelocity),
                SignalMath.absoluteDifferences(forearmVelocity), forearmWeight);

        int index = peakIndex(blended, elbowVelocity.length, cfg);
        int frame = index < valid.size() ? valid.get(index) : frames.size() / 2;
        double score = index < blended.length ? blended[index] : 0.0;

        int snapped = firstCompleteFrame(frames, frame, cfg.getNeighborRadius());
        if (snapped < 0) {
            LOG.debug("No complete pose within {} frames of {}; using maximum extension",
                    cfg.getNeighborRadius(), frame);
            return extensionFallback(frames, handedness);
        }
        LOG.debug("{} impact at frame {} (signal peak at {})", strokeType.key(), snapped, frame);
        return DetectionOutcome.detected(snapped, score);
    }

    /**
     * {@code (1 - w) * elbow + w * forearm} over the common length.
     */
    static double[] blend(double[] elbowAccel, double[] forearmAccel, double forearmWeight) {
        int len = Math.min(elbowAccel.length, forearmAccel.length);
        double[] out = new double[len];
        for (int i = 0; i < len; i++) {
            out[i] = (1.0 - forearmWeight) * elbowAccel[i] + forearmWeight * forearmAccel[i];
        }
        return out;
    }

    /**
     * Index of the first maximum of {@code signal} inside the configured search window,
     * or the middle velocity index when the signal is too short or the window is empty.
     */
    static int peakIndex(double[] signal, int velocityCount, PhaseDetectionProperties.Impact cfg) {
        int middle = velocityCount / 2;
        if (velocityCount < cfg.getMinVelocities() || signal.length == 0) {
            return middle;
        }
        int from = (int) (signal.length * cfg.getSearchStart());
        int to = (int) (signal.length * cfg.getSearchEnd());
        int peak = SignalMath.argMax(signal, from, to);
        return peak < 0 ? middle : peak;
    }

    /**
     * Scans {@code center - radius .. center + radius} in ascending order for the first
     * frame whose pose carries every landmark.
     *
     * @return the frame index, or -1 if none qualifies
     */
    static int firstCompleteFrame(FrameSequence frames, int center, int radius) {
        for (int i = center - radius; i <= center + radius; i++) {
            if (isComplete(frames, i)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isComplete(FrameSequence frames, int index) {
        return frames.pose(index).map(Pose::isComplete).orElse(false);
    }

    /**
     * Frame with the largest wrist-to-shoulder distance of the dominant arm.
     */
    static DetectionOutcome extensionFallback(FrameSequence frames, Handedness handedness) {
        double maxDistance = -1.0;
        int best = -1;
        for (int i = 0; i < frames.size(); i++) {
            Optional<Pose> pose = frames.pose(i);
            if (pose.isEmpty() || !pose.get().has(handedness.shoulder(), handedness.wrist())) {
                continue;
            }
            double d = JointGeometry.distance(pose.get().require(handedness.wrist()),
                    pose.get().require(handedness.shoulder()));
            if (d > maxDistance) {
                maxDistance = d;
                best = i;
            }
        }
        if (best < 0) {
            return DetectionOutcome.notFound(0.0);
        }
        return DetectionOutcome.fallback(best, maxDistance, DetectionOutcome.EXTENSION);
    }
}
