package com.phillippitts.strokecoach.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds used to classify alignment distances and report joint-angle deviations.
 *
 * <pre>
 * comparison.excellent-threshold=20
 * comparison.moderate-threshold=65
 * comparison.elbow-deviation-degrees=15
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "comparison")
public class ComparisonProperties {

    public static final double DEFAULT_EXCELLENT_THRESHOLD = 20.0;
    public static final double DEFAULT_MODERATE_THRESHOLD = 65.0;
    public static final double DEFAULT_ELBOW_DEVIATION_DEGREES = 15.0;

    @Positive
    private final double excellentThreshold;
    @Positive
    private final double moderateThreshold;
    @Positive
    private final double elbowDeviationDegrees;

    @ConstructorBinding
    public ComparisonProperties(Double excellentThreshold, Double moderateThreshold, Double elbowDeviationDegrees) {
        this.excellentThreshold = excellentThreshold == null ? DEFAULT_EXCELLENT_THRESHOLD : excellentThreshold;
        this.moderateThreshold = moderateThreshold == null ? DEFAULT_MODERATE_THRESHOLD : moderateThreshold;
        this.elbowDeviationDegrees = elbowDeviationDegrees == null
                ? DEFAULT_ELBOW_DEVIATION_DEGREES : elbowDeviationDegrees;
    }

    public static ComparisonProperties defaults() {
        return new ComparisonProperties(null, null, null);
    }

    /** Distances strictly below this are "Excellent similarity". */
    public double getExcellentThreshold() {
        return excellentThreshold;
    }

    /** Distances strictly below this (and not excellent) are "Moderate difference". */
    public double getModerateThreshold() {
        return moderateThreshold;
    }

    /** Elbow-angle differences strictly above this produce a deviation message. */
    public double getElbowDeviationDegrees() {
        return elbowDeviationDegrees;
    }

    @AssertTrue(message = "comparison.excellent-threshold must be below comparison.moderate-threshold")
    public boolean isThresholdOrderValid() {
        return excellentThreshold < moderateThreshold;
    }
}
