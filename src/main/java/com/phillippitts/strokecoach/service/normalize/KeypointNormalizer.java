package com.phillippitts.strokecoach.service.normalize;

import com.phillippitts.strokecoach.domain.BodyLandmarks;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.NormalizedPoint;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.exception.MissingLandmarksException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps raw image-relative landmarks into a body-relative frame so that samples
 * recorded at different camera distances and positions can be compared.
 *
 * <p>Origin is the shoulder midpoint, unit length is the shoulder width. A degenerate
 * shoulder width (coincident shoulders) floors the scale to 1.0.
 */
@Component
public class KeypointNormalizer {

    /**
     * Normalizes every landmark of the pose.
     *
     * @param pose landmarks including both shoulders
     * @return normalized points keyed by landmark index, in ascending index order
     * @throws MissingLandmarksException if either shoulder is absent
     */
    public Map<Integer, NormalizedPoint> normalize(Pose pose) {
        List<Integer> missing = new ArrayList<>(2);
        if (!pose.has(BodyLandmarks.LEFT_SHOULDER)) {
            missing.add(BodyLandmarks.LEFT_SHOULDER);
        }
        if (!pose.has(BodyLandmarks.RIGHT_SHOULDER)) {
            missing.add(BodyLandmarks.RIGHT_SHOULDER);
        }
        if (!missing.isEmpty()) {
            throw new MissingLandmarksException(missing);
        }

        Landmark left = pose.require(BodyLandmarks.LEFT_SHOULDER);
        Landmark right = pose.require(BodyLandmarks.RIGHT_SHOULDER);
        double cx = (left.x() + right.x()) / 2.0;
        double cy = (left.y() + right.y()) / 2.0;
        double scale = scale(left, right);

        Map<Integer, NormalizedPoint> out = new LinkedHashMap<>();
        pose.landmarks().forEach((index, lm) ->
                out.put(index, new NormalizedPoint(index, (lm.x() - cx) / scale, (lm.y() - cy) / scale)));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Normalized points for the given joints, in the given order. Joints absent from the
     * pose are skipped.
     */
    public List<NormalizedPoint> normalize(Pose pose, List<Integer> joints) {
        Map<Integer, NormalizedPoint> all = normalize(pose);
        List<NormalizedPoint> out = new ArrayList<>(joints.size());
        for (Integer j : joints) {
            NormalizedPoint p = all.get(j);
            if (p != null) {
                out.add(p);
            }
        }
        return out;
    }

    /**
     * Shoulder distance, or 1.0 when it is zero or not finite.
     */
    static double scale(Landmark left, Landmark right) {
        double d = Math.hypot(left.x() - right.x(), left.y() - right.y());
        return d > 0 && Double.isFinite(d) ? d : 1.0;
    }
}
