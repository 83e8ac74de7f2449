package com.phillippitts.strokecoach.service.analysis.event;

import com.phillippitts.strokecoach.service.metrics.AnalysisMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs job outcomes and records latency metrics.
 */
@Component
class AnalysisEventsListener {

    private static final Logger LOG = LogManager.getLogger(AnalysisEventsListener.class);

    private final AnalysisMetrics metrics;

    AnalysisEventsListener(AnalysisMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onCompleted(AnalysisCompletedEvent e) {
        String stroke = e.report().strokeType().key();
        metrics.recordLatency(stroke, "success", e.durationNanos());
        LOG.info("Analysis {} done in {} ms ({} frames)", e.jobId(), e.durationNanos() / 1_000_000L,
                e.report().frameCount());
    }

    @EventListener
    void onFailed(AnalysisFailedEvent e) {
        metrics.recordLatency(e.strokeType().key(), "timeout".equals(e.reason()) ? "timeout" : "failure",
                e.durationNanos());
        metrics.incrementFailure(e.reason());
        LOG.warn("Analysis {} failed: reason={}, message={}", e.jobId(), e.reason(), e.message());
    }
}
