package com.phillippitts.strokecoach.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Limits for asynchronous analysis jobs.
 *
 * <pre>
 * analysis.timeout=5m
 * analysis.job-retention=1h
 * analysis.max-jobs=200
 * analysis.upload-dir=${java.io.tmpdir}/strokecoach-uploads
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    @NotNull
    private final Duration timeout;
    @NotNull
    private final Duration jobRetention;
    @Positive
    private final int maxJobs;
    @NotBlank
    private final String uploadDir;

    @ConstructorBinding
    public AnalysisProperties(Duration timeout, Duration jobRetention, Integer maxJobs, String uploadDir) {
        this.timeout = timeout == null ? Duration.ofMinutes(5) : timeout;
        this.jobRetention = jobRetention == null ? Duration.ofHours(1) : jobRetention;
        this.maxJobs = maxJobs == null ? 200 : maxJobs;
        this.uploadDir = uploadDir == null
                ? System.getProperty("java.io.tmpdir") + "/strokecoach-uploads"
                : uploadDir;
    }

    /** Upper bound for one analysis, from pose estimation to comparison. */
    public Duration getTimeout() {
        return timeout;
    }

    /** Finished jobs older than this are evicted by the cleanup task. */
    public Duration getJobRetention() {
        return jobRetention;
    }

    public int getMaxJobs() {
        return maxJobs;
    }

    public String getUploadDir() {
        return uploadDir;
    }
}
