package com.phillippitts.strokecoach.service.pose;

import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.Pose;
import com.phillippitts.strokecoach.service.corpus.KeypointRecordCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the estimator's stdout:
 * <pre>
 * {"fps": 30.0, "frames": [{"landmarks": [{"x":..,"y":..,"z":..,"visibility":..}, ...]},
 *                          {"landmarks": null}, ...]}
 * </pre>
 * A frame whose landmark count differs from the expected count, or that carries a
 * malformed landmark, has no pose; the rest of the track is kept.
 */
final class PoseTrackJsonParser {

    private static final Logger LOG = LogManager.getLogger(PoseTrackJsonParser.class);

    private PoseTrackJsonParser() {
    }

    /**
     * @throws IllegalArgumentException if the document is not a pose track
     */
    static FrameSequence parse(String json, int expectedLandmarks) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty estimator output");
        }
        JSONObject root;
        try {
            root = new JSONObject(json.trim());
        } catch (JSONException e) {
            throw new IllegalArgumentException("Estimator output is not a JSON object: " + e.getMessage(), e);
        }
        JSONArray frames = root.optJSONArray("frames");
        if (frames == null) {
            throw new IllegalArgumentException("Estimator output has no 'frames' array");
        }
        double fps = root.optDouble("fps", FrameSequence.DEFAULT_FPS);

        List<Optional<Pose>> poses = new ArrayList<>(frames.length());
        for (int i = 0; i < frames.length(); i++) {
            poses.add(parseFrame(i, frames.opt(i), expectedLandmarks));
        }
        return new FrameSequence(poses, Double.isNaN(fps) ? FrameSequence.DEFAULT_FPS : fps);
    }

    private static Optional<Pose> parseFrame(int index, Object frame, int expectedLandmarks) {
        if (!(frame instanceof JSONObject obj)) {
            return Optional.empty();
        }
        JSONArray landmarks = obj.optJSONArray("landmarks");
        if (landmarks == null || landmarks.length() != expectedLandmarks) {
            return Optional.empty();
        }
        List<Landmark> decoded;
        try {
            decoded = KeypointRecordCodec.decode(landmarks);
        } catch (IllegalArgumentException e) {
            LOG.debug("Frame {} skipped: {}", index, e.getMessage());
            return Optional.empty();
        }
        if (decoded.contains(null)) {
            return Optional.empty();
        }
        return Optional.of(Pose.of(decoded));
    }
}
