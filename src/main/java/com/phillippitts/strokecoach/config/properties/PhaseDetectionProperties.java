package com.phillippitts.strokecoach.config.properties;

import com.phillippitts.strokecoach.domain.StrokeType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Every tunable constant of the three phase detectors, keyed by stroke type.
 *
 * <p>Stroke-specific values live under {@code detection.forehand.*},
 * {@code detection.backhand.*} and {@code detection.serve.*}; constants shared by all
 * strokes live under {@code detection.impact.*} and {@code detection.follow-through.*}.
 *
 * <pre>
 * detection.forehand.target-elbow-angle=110
 * detection.serve.window-start=0.05
 * detection.impact.neighbor-radius=5
 * detection.follow-through.threshold-ratio=0.7
 * </pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "detection")
public class PhaseDetectionProperties {

    @Valid
    private Stroke forehand = Stroke.forehand();
    @Valid
    private Stroke backhand = Stroke.backhand();
    @Valid
    private Stroke serve = Stroke.serve();
    @Valid
    private Impact impact = new Impact();
    @Valid
    private FollowThrough followThrough = new FollowThrough();

    public Stroke forStroke(StrokeType type) {
        return switch (type) {
            case FOREHAND -> forehand;
            case BACKHAND -> backhand;
            case SERVE -> serve;
        };
    }

    public Stroke getForehand() {
        return forehand;
    }

    public void setForehand(Stroke forehand) {
        this.forehand = forehand;
    }

    public Stroke getBackhand() {
        return backhand;
    }

    public void setBackhand(Stroke backhand) {
        this.backhand = backhand;
    }

    public Stroke getServe() {
        return serve;
    }

    public void setServe(Stroke serve) {
        this.serve = serve;
    }

    public Impact getImpact() {
        return impact;
    }

    public void setImpact(Impact impact) {
        this.impact = impact;
    }

    public FollowThrough getFollowThrough() {
        return followThrough;
    }

    public void setFollowThrough(FollowThrough followThrough) {
        this.followThrough = followThrough;
    }

    /**
     * Stroke-specific targets and weights.
     *
     * <p>Preparation window bounds are fractions of the sequence length. Wrist height is
     * {@code wrist.y - shoulder.y} in image-normalized units (negative means the wrist is
     * above the shoulder). The follow-through target is the wrist offset from the
     * shoulder for a right-handed player.
     */
    public static class Stroke {

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double windowStart;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double windowEnd;

        private double targetElbowAngle;
        @Positive
        private double elbowTolerance;
        private double targetShoulderTilt;
        @Positive
        private double shoulderTiltTolerance = 45.0;
        private double targetWristHeight;
        @Positive
        private double wristHeightTolerance;

        @DecimalMin("0.0")
        private double elbowWeight = 0.5;
        @DecimalMin("0.0")
        private double shoulderWeight;
        @DecimalMin("0.0")
        private double heightWeight;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double minScore;

        @DecimalMin("0.0") @DecimalMax("1.0")
        private double forearmWeight;

        private double followThroughTargetX;
        private double followThroughTargetY;

        static Stroke forehand() {
            Stroke s = new Stroke();
            s.windowStart = 0.10;
            s.windowEnd = 0.60;
            s.targetElbowAngle = 110;
            s.elbowTolerance = 30;
            s.targetShoulderTilt = 15;
            s.targetWristHeight = -0.05;
            s.wristHeightTolerance = 0.15;
            s.shoulderWeight = 0.20;
            s.heightWeight = 0.30;
            s.minScore = 0.5;
            s.forearmWeight = 0.6;
            s.followThroughTargetX = -0.3;
            s.followThroughTargetY = -0.2;
            return s;
        }

        static Stroke backhand() {
            Stroke s = new Stroke();
            s.windowStart = 0.10;
            s.windowEnd = 0.60;
            s.targetElbowAngle = 120;
            s.elbowTolerance = 25;
            s.targetShoulderTilt = 25;
            s.targetWristHeight = 0.0;
            s.wristHeightTolerance = 0.12;
            s.shoulderWeight = 0.20;
            s.heightWeight = 0.30;
            s.minScore = 0.5;
            s.forearmWeight = 0.6;
            s.followThroughTargetX = 0.4;
            s.followThroughTargetY = -0.1;
            return s;
        }

        static Stroke serve() {
            Stroke s = new Stroke();
            s.windowStart = 0.05;
            s.windowEnd = 0.40;
            s.targetElbowAngle = 90;
            s.elbowTolerance = 35;
            s.targetShoulderTilt = 30;
            s.targetWristHeight = -0.20;
            s.wristHeightTolerance = 0.20;
            s.shoulderWeight = 0.30;
            s.heightWeight = 0.20;
            s.minScore = 0.4;
            s.forearmWeight = 0.7;
            s.followThroughTargetX = -0.4;
            s.followThroughTargetY = 0.3;
            return s;
        }

        @AssertTrue(message = "preparation weights must sum to at most 1")
        public boolean isWeightSumValid() {
            return elbowWeight + shoulderWeight + heightWeight <= 1.0 + 1e-9;
        }

        @AssertTrue(message = "window-start must not exceed window-end")
        public boolean isWindowValid() {
            return windowStart <= windowEnd;
        }

        public double getWindowStart() {
            return windowStart;
        }

        public void setWindowStart(double windowStart) {
            this.windowStart = windowStart;
        }

        public double getWindowEnd() {
            return windowEnd;
        }

        public void setWindowEnd(double windowEnd) {
            this.windowEnd = windowEnd;
        }

        public double getTargetElbowAngle() {
            return targetElbowAngle;
        }

        public void setTargetElbowAngle(double targetElbowAngle) {
            this.targetElbowAngle = targetElbowAngle;
        }

        public double getElbowTolerance() {
            return elbowTolerance;
        }

        public void setElbowTolerance(double elbowTolerance) {
            this.elbowTolerance = elbowTolerance;
        }

        public double getTargetShoulderTilt() {
            return targetShoulderTilt;
        }

        public void setTargetShoulderTilt(double targetShoulderTilt) {
            this.targetShoulderTilt = targetShoulderTilt;
        }

        public double getShoulderTiltTolerance() {
            return shoulderTiltTolerance;
        }

        public void setShoulderTiltTolerance(double shoulderTiltTolerance) {
            this.shoulderTiltTolerance = shoulderTiltTolerance;
        }

        public double getTargetWristHeight() {
            return targetWristHeight;
        }

        public void setTargetWristHeight(double targetWristHeight) {
            this.targetWristHeight = targetWristHeight;
        }

        public double getWristHeightTolerance() {
            return wristHeightTolerance;
        }

        public void setWristHeightTolerance(double wristHeightTolerance) {
            this.wristHeightTolerance = wristHeightTolerance;
        }

        public double getElbowWeight() {
            return elbowWeight;
        }

        public void setElbowWeight(double elbowWeight) {
            this.elbowWeight = elbowWeight;
        }

        public double getShoulderWeight() {
            return shoulderWeight;
        }

        public void setShoulderWeight(double shoulderWeight) {
            this.shoulderWeight = shoulderWeight;
        }

        public double getHeightWeight() {
            return heightWeight;
        }

        public void setHeightWeight(double heightWeight) {
            this.heightWeight = heightWeight;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public double getForearmWeight() {
            return forearmWeight;
        }

        public void setForearmWeight(double forearmWeight) {
            this.forearmWeight = forearmWeight;
        }

        public double getFollowThroughTargetX() {
            return followThroughTargetX;
        }

        public void setFollowThroughTargetX(double followThroughTargetX) {
            this.followThroughTargetX = followThroughTargetX;
        }

        public double getFollowThroughTargetY() {
            return followThroughTargetY;
        }

        public void setFollowThroughTargetY(double followThroughTargetY) {
            this.followThroughTargetY = followThroughTargetY;
        }
    }

    /**
     * Impact detector constants shared by all strokes.
     */
    public static class Impact {
        @Min(1)
        private int smoothingWindow = 3;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double searchStart = 0.25;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double searchEnd = 0.75;
        @Min(1)
        private int minVelocities = 5;
        @Min(0)
        private int neighborRadius = 5;
        @Min(1)
        private int minValidFrames = 10;

        public int getSmoothingWindow() {
            return smoothingWindow;
        }

        public void setSmoothingWindow(int smoothingWindow) {
            this.smoothingWindow = smoothingWindow;
        }

        public double getSearchStart() {
            return searchStart;
        }

        public void setSearchStart(double searchStart) {
            this.searchStart = searchStart;
        }

        public double getSearchEnd() {
            return searchEnd;
        }

        public void setSearchEnd(double searchEnd) {
            this.searchEnd = searchEnd;
        }

        public int getMinVelocities() {
            return minVelocities;
        }

        public void setMinVelocities(int minVelocities) {
            this.minVelocities = minVelocities;
        }

        public int getNeighborRadius() {
            return neighborRadius;
        }

        public void setNeighborRadius(int neighborRadius) {
            this.neighborRadius = neighborRadius;
        }

        public int getMinValidFrames() {
            return minValidFrames;
        }

        public void setMinValidFrames(int minValidFrames) {
            this.minValidFrames = minValidFrames;
        }
    }

    /**
     * Follow-through detector constants shared by all strokes.
     */
    public static class FollowThrough {
        private double minElbowAngle = 60.0;
        @Positive
        private double elbowAngleRange = 120.0;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double extensionWeight = 0.6;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double thresholdRatio = 0.7;
        @Min(0)
        private int stabilizationFrames = 5;
        @Positive
        private double stabilizationDisplacement = 0.02;
        @DecimalMin("0.0") @DecimalMax("1.0")
        private double temporalFallbackRatio = 0.75;
        @Min(1)
        private int minFrames = 10;

        public double getMinElbowAngle() {
            return minElbowAngle;
        }

        public void setMinElbowAngle(double minElbowAngle) {
            this.minElbowAngle = minElbowAngle;
        }

        public double getElbowAngleRange() {
            return elbowAngleRange;
        }

        public void setElbowAngleRange(double elbowAngleRange) {
            this.elbowAngleRange = elbowAngleRange;
        }

        public double getExtensionWeight() {
            return extensionWeight;
        }

        public void setExtensionWeight(double extensionWeight) {
            this.extensionWeight = extensionWeight;
        }

        public double getThresholdRatio() {
            return thresholdRatio;
        }

        public void setThresholdRatio(double thresholdRatio) {
            this.thresholdRatio = thresholdRatio;
        }

        public int getStabilizationFrames() {
            return stabilizationFrames;
        }

        public void setStabilizationFrames(int stabilizationFrames) {
            this.stabilizationFrames = stabilizationFrames;
        }

        public double getStabilizationDisplacement() {
            return stabilizationDisplacement;
        }

        public void setStabilizationDisplacement(double stabilizationDisplacement) {
            this.stabilizationDisplacement = stabilizationDisplacement;
        }

        public double getTemporalFallbackRatio() {
            return temporalFallbackRatio;
        }

        public void setTemporalFallbackRatio(double temporalFallbackRatio) {
            this.temporalFallbackRatio = temporalFallbackRatio;
        }

        public int getMinFrames() {
            return minFrames;
        }

        public void setMinFrames(int minFrames) {
            this.minFrames = minFrames;
        }
    }
}
