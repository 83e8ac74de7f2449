package com.phillippitts.strokecoach.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Landmarks detected for a single frame, keyed by body-model index.
 *
 * <p>A pose read back from a keypoint record may be partial; a pose emitted by the
 * pose estimator always carries the full landmark set.
 */
public final class Pose {

    private final Map<Integer, Landmark> landmarks;

    private Pose(Map<Integer, Landmark> landmarks) {
        this.landmarks = Collections.unmodifiableMap(landmarks);
    }

    /**
     * Creates a pose from an ordered landmark list, using the list position as index.
     */
    public static Pose of(List<Landmark> ordered) {
        Map<Integer, Landmark> map = new TreeMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            Landmark lm = ordered.get(i);
            if (lm != null) {
                map.put(i, lm);
            }
        }
        return new Pose(map);
    }

    public static Pose of(Map<Integer, Landmark> byIndex) {
        return new Pose(new TreeMap<>(byIndex));
    }

    public Optional<Landmark> landmark(int index) {
        return Optional.ofNullable(landmarks.get(index));
    }

    /**
     * @throws IllegalStateException if the landmark is absent; callers check {@link #has} first
     */
    public Landmark require(int index) {
        Landmark lm = landmarks.get(index);
        if (lm == null) {
            throw new IllegalStateException("Landmark " + index + " not present");
        }
        return lm;
    }

    public boolean has(int... indices) {
        for (int i : indices) {
            if (!landmarks.containsKey(i)) {
                return false;
            }
        }
        return true;
    }

    public boolean isComplete() {
        return landmarks.size() == BodyLandmarks.COUNT;
    }

    public Map<Integer, Landmark> landmarks() {
        return landmarks;
    }

    /**
     * Landmarks as a dense list (index = position) for serialization; gaps are null.
     */
    public List<Landmark> toList() {
        int size = landmarks.isEmpty() ? 0 : Collections.max(landmarks.keySet()) + 1;
        List<Landmark> out = new ArrayList<>(Collections.nCopies(size, (Landmark) null));
        landmarks.forEach(out::set);
        return out;
    }

    public int size() {
        return landmarks.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Pose other && landmarks.equals(other.landmarks);
    }

    @Override
    public int hashCode() {
        return landmarks.hashCode();
    }

    @Override
    public String toString() {
        return "Pose[landmarks=" + landmarks.size() + "]";
    }
}
