package com.phillippitts.strokecoach.presentation.dto;

import com.phillippitts.strokecoach.domain.Landmark;

/**
 * Wire form of a landmark. {@code z} defaults to 0 and {@code visibility} to 1 when absent.
 */
public record LandmarkDto(double x, double y, Double z, Double visibility) {

    public Landmark toLandmark() {
        return new Landmark(x, y, z == null ? 0.0 : z, visibility == null ? 1.0 : visibility);
    }

    public static LandmarkDto from(Landmark lm) {
        return lm == null ? null : new LandmarkDto(lm.x(), lm.y(), lm.z(), lm.visibility());
    }
}
