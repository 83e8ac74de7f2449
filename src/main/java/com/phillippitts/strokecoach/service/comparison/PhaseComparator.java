package com.phillippitts.strokecoach.service.comparison;

import com.phillippitts.strokecoach.config.properties.ComparisonProperties;
import com.phillippitts.strokecoach.domain.BodyLandmarks;
import com.phillippitts.strokecoach.domain.NormalizedPoint;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.domain.SimilarityTier;
import com.phillippitts.strokecoach.service.geometry.JointGeometry;
import com.phillippitts.strokecoach.service.normalize.KeypointNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Compares one phase pose of a user against the same phase of a reference: DTW over
 * the compared joints plus elbow-angle deviations, both in the normalized frame.
 */
@Component
public class PhaseComparator {

    private final KeypointNormalizer normalizer;
    private final SequenceAligner aligner;
    private final ComparisonProperties properties;

    public PhaseComparator(KeypointNormalizer normalizer, SequenceAligner aligner, ComparisonProperties properties) {
        this.normalizer = Objects.requireNonNull(normalizer);
        this.aligner = Objects.requireNonNull(aligner);
        this.properties = Objects.requireNonNull(properties);
    }

    /**
     * Normalized compared joints of a pose, in {@link BodyLandmarks#COMPARED_JOINTS} order.
     *
     * @return empty when the pose lacks a shoulder or every compared joint
     */
    public Optional<Map<Integer, NormalizedPoint>> prepare(Pose pose) {
        if (!pose.has(BodyLandmarks.LEFT_SHOULDER, BodyLandmarks.RIGHT_SHOULDER)) {
            return Optional.empty();
        }
        Map<Integer, NormalizedPoint> all = normalizer.normalize(pose);
        boolean anyCompared = BodyLandmarks.COMPARED_JOINTS.stream().anyMatch(all::containsKey);
        return anyCompared ? Optional.of(all) : Optional.empty();
    }

    /**
     * Compares two prepared poses (see {@link #prepare}).
     */
    public PhaseComparison compare(Phase phase, Map<Integer, NormalizedPoint> user, Map<Integer, NormalizedPoint> reference) {
        double distance = aligner.distance(sequence(user), sequence(reference));

        OptionalDouble left = elbowDelta(user, reference,
                BodyLandmarks.LEFT_SHOULDER, BodyLandmarks.LEFT_ELBOW, BodyLandmarks.LEFT_WRIST);
        OptionalDouble right = elbowDelta(user, reference,
                BodyLandmarks.RIGHT_SHOULDER, BodyLandmarks.RIGHT_ELBOW, BodyLandmarks.RIGHT_WRIST);

        List<String> deviations = new ArrayList<>(2);
        double limit = properties.getElbowDeviationDegrees();
        if (left.isPresent() && left.getAsDouble() > limit) {
            deviations.add(String.format(Locale.ROOT, "Left elbow angle differs by %.1f°.", left.getAsDouble()));
        }
        if (right.isPresent() && right.getAsDouble() > limit) {
            deviations.add(String.format(Locale.ROOT, "Right elbow angle differs by %.1f°.", right.getAsDouble()));
        }
        return new PhaseComparison(phase, distance, left, right, deviations, tier(distance));
    }

    public SimilarityTier tier(double distance) {
        if (distance < properties.getExcellentThreshold()) {
            return SimilarityTier.EXCELLENT;
        }
        if (distance < properties.getModerateThreshold()) {
            return SimilarityTier.MODERATE;
        }
        return SimilarityTier.HIGH;
    }

    static List<NormalizedPoint> sequence(Map<Integer, NormalizedPoint> points) {
        List<NormalizedPoint> out = new ArrayList<>(BodyLandmarks.COMPARED_JOINTS.size());
        for (Integer joint : BodyLandmarks.COMPARED_JOINTS) {
            NormalizedPoint p = points.get(joint);
            if (p != null) {
                out.add(p);
            }
        }
        return out;
    }

    private static OptionalDouble elbowDelta(Map<Integer, NormalizedPoint> user, Map<Integer, NormalizedPoint> ref,
                                             int shoulder, int elbow, int wrist) {
        if (!hasAll(user, shoulder, elbow, wrist) || !hasAll(ref, shoulder, elbow, wrist)) {
            return OptionalDouble.empty();
        }
        double u = JointGeometry.angleBetween(user.get(shoulder), user.get(elbow), user.get(wrist));
        double r = JointGeometry.angleBetween(ref.get(shoulder), ref.get(elbow), ref.get(wrist));
        return OptionalDouble.of(Math.abs(u - r));
    }

    private static boolean hasAll(Map<Integer, NormalizedPoint> points, int... indices) {
        for (int i : indices) {
            if (!points.containsKey(i)) {
                return false;
            }
        }
        return true;
    }
}
