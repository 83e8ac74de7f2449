package com.phillippitts.strokecoach.service.corpus;

import com.phillippitts.strokecoach.domain.Landmark;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes per-phase keypoint records: a JSON array of
 * {@code {x, y, z, visibility}} objects where the array position is the landmark index.
 *
 * <p>A {@code null} element marks a landmark that was not tracked.
 */
public final class KeypointRecordCodec {

    private KeypointRecordCodec() {
    }

    /**
     * @throws IllegalArgumentException if the text is not a JSON array of landmark objects
     */
    public static List<Landmark> decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Keypoint record is empty");
        }
        try {
            return decode(new JSONArray(json));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed keypoint record: " + e.getMessage(), e);
        }
    }

    public static List<Landmark> decode(JSONArray array) {
        List<Landmark> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            if (array.isNull(i)) {
                out.add(null);
                continue;
            }
            JSONObject obj = array.optJSONObject(i);
            if (obj == null) {
                throw new IllegalArgumentException("Landmark " + i + " is not an object");
            }
            out.add(decodeLandmark(obj, i));
        }
        return out;
    }

    static Landmark decodeLandmark(JSONObject obj, int index) {
        if (!obj.has("x") || !obj.has("y")) {
            throw new IllegalArgumentException("Landmark " + index + " lacks x/y");
        }
        double x;
        double y;
        try {
            x = obj.getDouble("x");
            y = obj.getDouble("y");
        } catch (JSONException e) {
            throw new IllegalArgumentException("Landmark " + index + " has non-numeric coordinates", e);
        }
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Landmark " + index + " has non-finite coordinates");
        }
        return new Landmark(x, y, obj.optDouble("z", 0.0), obj.optDouble("visibility", 1.0));
    }

    public static String encode(List<Landmark> landmarks) {
        JSONArray array = new JSONArray();
        for (Landmark lm : landmarks) {
            if (lm == null) {
                array.put(JSONObject.NULL);
            } else {
                array.put(new JSONObject()
                        .put("x", lm.x())
                        .put("y", lm.y())
                        .put("z", lm.z())
                        .put("visibility", lm.visibility()));
            }
        }
        return array.toString();
    }
}
