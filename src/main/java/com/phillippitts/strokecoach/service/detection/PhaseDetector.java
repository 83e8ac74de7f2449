package com.phillippitts.strokecoach.service.detection;

import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.FrameSequence;
import com.phillippitts.strokecoach.domain.Handedness;
import com.phillippitts.strokecoach.domain.Phase;
import com.phillippitts.strokecoach.domain.StrokeType;

/**
 * Selects the single frame that best represents one stroke phase.
 *
 * <p>Implementations must be stateless and thread-safe; the three detectors run
 * concurrently over the same sequence. Absence of a suitable frame is reported as
 * {@link DetectionOutcome.Kind#NOT_FOUND}, never as an exception.
 */
public interface PhaseDetector {

    Phase phase();

    DetectionOutcome detect(FrameSequence frames, StrokeType strokeType, Handedness handedness);
}
