package com.phillippitts.strokecoach.domain;

/**
 * One tracked anatomical point in image-relative coordinates.
 *
 * @param x horizontal position in [0,1] of the image width
 * @param y vertical position in [0,1] of the image height (grows downwards)
 * @param z depth relative to the hips (model specific scale)
 * @param visibility detector confidence in [0,1]
 */
public record Landmark(double x, double y, double z, double visibility) {

    public static Landmark of(double x, double y) {
        return new Landmark(x, y, 0.0, 1.0);
    }
}
