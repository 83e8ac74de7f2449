package com.phillippitts.strokecoach.service.pose;

import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.exception.InvalidVideoException;
import com.phillippitts.strokecoach.exception.PoseEstimatorException;

import java.nio.file.Path;

/**
 * Turns a video into one pose-or-none per frame.
 *
 * <p>Implementations must be thread-safe: several analyses may estimate concurrently.
 */
public interface PoseSource {

    /**
     * @param video readable video file
     * @return decoded frames with their poses and frame rate
     * @throws InvalidVideoException if the video cannot be decoded
     * @throws PoseEstimatorException if the estimator itself cannot run
     */
    FrameSequence estimate(Path video);

    /** Short name used in logs and error messages. */
    String name();
}
