package com.phillippitts.strokecoach.service.metrics;

import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.Phase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for stroke analysis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Analysis latency by stroke type and outcome</li>
 *   <li>Detector outcomes per phase (detected, fallback, not_found)</li>
 *   <li>Comparison outcomes (matched, no_reference)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "strokecoach.analysis";

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param strokeType stroke type key
     * @param outcome {@code success}, {@code failure} or {@code timeout}
     */
    public void recordLatency(String strokeType, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to analyze one video")
                .tag("stroke", strokeType)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordPhaseOutcome(Phase phase, DetectionOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".phase")
                .description("Detector outcomes by phase and tier")
                .tag("phase", phase.key())
                .tag("kind", outcome.kind().name().toLowerCase(Locale.ROOT))
                .tag("method", outcome.method())
                .register(registry)
                .increment();
    }

    public void recordComparison(String strokeType, boolean matched) {
        Counter.builder(METRIC_PREFIX + ".comparison")
                .description("Comparisons against the reference corpus")
                .tag("stroke", strokeType)
                .tag("result", matched ? "matched" : "no_reference")
                .register(registry)
                .increment();
    }

    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed analyses")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
