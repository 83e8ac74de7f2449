package com.phillippitts.strokecoach.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for failures of the external pose estimator process.
 *
 * <p>Produces either an {@link InvalidVideoException} (the estimator ran and rejected
 * the input) or a {@link PoseEstimatorException} (the estimator could not run), with a
 * message carrying the exit code, duration and metadata:
 * <pre>
 * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
 * </pre>
 *
 * <pre>
 * throw PoseEstimatorExceptionBuilder.create("Non-zero exit: 2")
 *         .exitCode(2)
 *         .durationMs(1500)
 *         .metadata("video", video.getFileName())
 *         .metadata("stderr", stderrSnippet)
 *         .buildInvalidVideo();
 * </pre>
 */
public final class PoseEstimatorExceptionBuilder {

    private final String message;
    private String estimator;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private PoseEstimatorExceptionBuilder(String message) {
        this.message = message;
    }

    public static PoseEstimatorExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new PoseEstimatorExceptionBuilder(message);
    }

    public PoseEstimatorExceptionBuilder estimator(String estimator) {
        this.estimator = estimator;
        return this;
    }

    public PoseEstimatorExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public PoseEstimatorExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public PoseEstimatorExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata pair; null keys or values are ignored.
     */
    public PoseEstimatorExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public InvalidVideoException buildInvalidVideo() {
        String detailed = buildDetailedMessage();
        return cause != null ? new InvalidVideoException(detailed, cause) : new InvalidVideoException(detailed);
    }

    public PoseEstimatorException buildUnavailable() {
        String detailed = buildDetailedMessage();
        String name = estimator != null ? estimator : "unknown";
        return cause != null
                ? new PoseEstimatorException(detailed, name, cause)
                : new PoseEstimatorException(detailed, name);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
