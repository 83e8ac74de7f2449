package com.phillippitts.strokecoach.util;

import java.time.Duration;

/**
 * Timeouts for external process and stream-reader lifecycle.
 *
 * @see com.phillippitts.strokecoach.service.pose.ProcessPoseSource
 */
public final class ProcessTimeouts {

    /**
     * Time given to stream reader threads to drain buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort wait for reader threads during cleanup. Readers are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
