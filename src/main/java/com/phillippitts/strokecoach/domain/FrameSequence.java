package com.phillippitts.strokecoach.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decoded video as seen by the detectors: one pose-or-none per frame plus the frame rate.
 */
public final class FrameSequence {

    public static final double DEFAULT_FPS = 30.0;

    private final List<Optional<Pose>> poses;
    private final double fps;

    public FrameSequence(List<Optional<Pose>> poses, double fps) {
        this.poses = Collections.unmodifiableList(new ArrayList<>(poses));
        this.fps = fps > 0 && Double.isFinite(fps) ? fps : DEFAULT_FPS;
    }

    public int size() {
        return poses.size();
    }

    public boolean isEmpty() {
        return poses.isEmpty();
    }

    public Optional<Pose> pose(int frame) {
        if (frame < 0 || frame >= poses.size()) {
            return Optional.empty();
        }
        return poses.get(frame);
    }

    public double fps() {
        return fps;
    }

    /** Indices of frames that carry a pose, in ascending order. */
    public List<Integer> validFrames() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < poses.size(); i++) {
            if (poses.get(i).isPresent()) {
                out.add(i);
            }
        }
        return out;
    }

    public int validCount() {
        int n = 0;
        for (Optional<Pose> p : poses) {
            if (p.isPresent()) {
                n++;
            }
        }
        return n;
    }
}
