package com.phillippitts.strokecoach.service.geometry;

/**
 * Smoothing and finite-difference helpers for per-frame angle signals.
 */
public final class SignalMath {

    private SignalMath() {
    }

    /**
     * Centered moving average; the window shrinks at both ends of the signal.
     * Signals shorter than {@code window} are returned as a copy, unsmoothed.
     */
    public static double[] movingAverage(double[] signal, int window) {
        if (window <= 1 || signal.length < window) {
            return signal.clone();
        }
        int half = window / 2;
        double[] out = new double[signal.length];
        for (int i = 0; i < signal.length; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(signal.length, i + half + 1);
            double sum = 0.0;
            for (int j = start; j < end; j++) {
                sum += signal[j];
            }
            out[i] = sum / (end - start);
        }
        return out;
    }

    /**
     * Frame-to-frame angular velocity in degrees per second. Length is {@code n - 1}.
     */
    public static double[] angularVelocity(double[] anglesDeg, double fps) {
        if (anglesDeg.length < 2) {
            return new double[0];
        }
        double[] out = new double[anglesDeg.length - 1];
        for (int i = 1; i < anglesDeg.length; i++) {
            out[i - 1] = JointGeometry.wrapDegrees(anglesDeg[i] - anglesDeg[i - 1]) * fps;
        }
        return out;
    }

    /**
     * Absolute consecutive differences. Length is {@code n - 1}.
     */
    public static double[] absoluteDifferences(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = Math.abs(values[i] - values[i - 1]);
        }
        return out;
    }

    /**
     * Index of the first maximum within {@code [from, to)}, or -1 when the range is empty.
     */
    public static int argMax(double[] values, int from, int to) {
        int best = -1;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = Math.max(0, from); i < Math.min(values.length, to); i++) {
            if (values[i] > max) {
                max = values[i];
                best = i;
            }
        }
        return best;
    }
}
