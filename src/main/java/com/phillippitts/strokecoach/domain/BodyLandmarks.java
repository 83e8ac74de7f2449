package com.phillippitts.strokecoach.domain;

import java.util.List;

/**
 * Landmark indices of the 33-point body model produced by the pose estimator.
 * Odd indices are the left side of the body, even indices the right side.
 */
public final class BodyLandmarks {

    public static final int COUNT = 33;

    public static final int LEFT_SHOULDER = 11;
    public static final int RIGHT_SHOULDER = 12;
    public static final int LEFT_ELBOW = 13;
    public static final int RIGHT_ELBOW = 14;
    public static final int LEFT_WRIST = 15;
    public static final int RIGHT_WRIST = 16;
    public static final int LEFT_HIP = 23;
    public static final int RIGHT_HIP = 24;
    public static final int LEFT_KNEE = 25;
    public static final int RIGHT_KNEE = 26;
    public static final int LEFT_ANKLE = 27;
    public static final int RIGHT_ANKLE = 28;

    /** Joints compared between a user sample and a reference sample, in alignment order. */
    public static final List<Integer> COMPARED_JOINTS = List.of(
            LEFT_SHOULDER, RIGHT_SHOULDER,
            LEFT_ELBOW, RIGHT_ELBOW,
            LEFT_WRIST, RIGHT_WRIST,
            LEFT_HIP, RIGHT_HIP,
            LEFT_KNEE, RIGHT_KNEE,
            LEFT_ANKLE, RIGHT_ANKLE
    );

    private BodyLandmarks() {
    }
}
