package com.phillippitts.strokecoach.service.geometry;

import com.phillippitts.strokecoach.domain.Landmark;
import com.phillippitts.strokecoach.domain.NormalizedPoint;

/**
 * Planar angle and distance primitives shared by the detectors and the aligner.
 * Only the x/y components are used; depth is ignored.
 */
public final class JointGeometry {

    private JointGeometry() {
    }

    /**
     * Angle at {@code vertex} formed by the segments to {@code a} and {@code c}, in degrees [0, 180].
     * Returns 0 when either segment has zero length.
     */
    public static double angleBetween(double ax, double ay, double vx, double vy, double cx, double cy) {
        double ux = ax - vx;
        double uy = ay - vy;
        double wx = cx - vx;
        double wy = cy - vy;
        double normU = Math.hypot(ux, uy);
        double normW = Math.hypot(wx, wy);
        if (normU == 0.0 || normW == 0.0) {
            return 0.0;
        }
        double cos = (ux * wx + uy * wy) / (normU * normW);
        cos = Math.max(-1.0, Math.min(1.0, cos));
        return Math.toDegrees(Math.acos(cos));
    }

    public static double angleBetween(Landmark a, Landmark vertex, Landmark c) {
        return angleBetween(a.x(), a.y(), vertex.x(), vertex.y(), c.x(), c.y());
    }

    public static double angleBetween(NormalizedPoint a, NormalizedPoint vertex, NormalizedPoint c) {
        return angleBetween(a.x(), a.y(), vertex.x(), vertex.y(), c.x(), c.y());
    }

    public static double distance(Landmark a, Landmark b) {
        return Math.hypot(a.x() - b.x(), a.y() - b.y());
    }

    public static double distance(NormalizedPoint a, NormalizedPoint b) {
        return Math.hypot(a.x() - b.x(), a.y() - b.y());
    }

    /**
     * Direction of the segment {@code from -> to} relative to the image horizontal, in degrees (-180, 180].
     */
    public static double orientation(Landmark from, Landmark to) {
        return Math.toDegrees(Math.atan2(to.y() - from.y(), to.x() - from.x()));
    }

    /**
     * Wraps an angular difference into [-180, 180].
     */
    public static double wrapDegrees(double delta) {
        double d = delta;
        while (d > 180.0) {
            d -= 360.0;
        }
        while (d < -180.0) {
            d += 360.0;
        }
        return d;
    }

    /**
     * {@code max(0, 1 - |measured - target| / tolerance)}.
     */
    public static double closeness(double measured, double target, double tolerance) {
        if (tolerance <= 0) {
            return measured == target ? 1.0 : 0.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(measured - target) / tolerance);
    }
}
