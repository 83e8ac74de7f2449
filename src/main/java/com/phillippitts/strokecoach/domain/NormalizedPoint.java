package com.phillippitts.strokecoach.domain;

/**
 * Landmark position in the body-relative frame: origin at the shoulder midpoint,
 * unit length equal to the shoulder width.
 */
public record NormalizedPoint(int index, double x, double y) {
}
