package com.phillippitts.strokecoach.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the external pose-estimator process.
 *
 * <p>Example application.properties:
 * <pre>
 * pose.estimator.binary-path=python3
 * pose.estimator.script-path=tools/pose_estimator.py
 * pose.estimator.timeout-seconds=120
 * pose.estimator.max-stdout-bytes=67108864
 * pose.estimator.expected-landmarks=33
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "pose.estimator")
public class PoseEstimatorProperties {

    @NotBlank(message = "Pose estimator binary path must not be blank")
    private final String binaryPath;

    private final String scriptPath;

    @Positive(message = "Timeout must be positive")
    private final int timeoutSeconds;

    @Positive(message = "Max stdout bytes must be positive")
    private final int maxStdoutBytes;

    @Positive
    private final int expectedLandmarks;

    @ConstructorBinding
    public PoseEstimatorProperties(String binaryPath,
                                   String scriptPath,
                                   Integer timeoutSeconds,
                                   Integer maxStdoutBytes,
                                   Integer expectedLandmarks) {
        this.binaryPath = binaryPath == null ? "python3" : binaryPath;
        this.scriptPath = scriptPath == null ? "tools/pose_estimator.py" : scriptPath;
        this.timeoutSeconds = timeoutSeconds == null ? 120 : timeoutSeconds;
        // pose tracks of a few hundred frames are a few MB; the cap guards against runaway output
        this.maxStdoutBytes = maxStdoutBytes == null ? 64 * 1024 * 1024 : maxStdoutBytes;
        this.expectedLandmarks = expectedLandmarks == null ? 33 : expectedLandmarks;
    }

    public String getBinaryPath() {
        return binaryPath;
    }

    /** Script passed as first argument to the binary; blank when the binary is self-contained. */
    public String getScriptPath() {
        return scriptPath;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public int getExpectedLandmarks() {
        return expectedLandmarks;
    }
}
