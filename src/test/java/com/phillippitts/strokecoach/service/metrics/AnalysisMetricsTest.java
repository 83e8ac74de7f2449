package com.phillippitts.strokecoach.service.metrics;

import com.phillippitts.strokecoach.domain.DetectionOutcome;
import com.phillippitts.strokecoach.domain.Phase;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisMetricsTest {

    private MeterRegistry registry;
    private AnalysisMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AnalysisMetrics(registry);
    }

    @Test
    void latencyIsTaggedByStrokeAndOutcome() {
        metrics.recordLatency("forehand", "success", TimeUnit.MILLISECONDS.toNanos(250));
        metrics.recordLatency("forehand", "success", TimeUnit.MILLISECONDS.toNanos(750));

        Timer timer = registry.get("strokecoach.analysis.latency")
                .tag("stroke", "forehand").tag("outcome", "success").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(1000.0);
    }

    @Test
    void phaseOutcomesCarryKindAndMethod() {
        metrics.recordPhaseOutcome(Phase.IMPACT, DetectionOutcome.detected(10, 3.0));
        metrics.recordPhaseOutcome(Phase.IMPACT, DetectionOutcome.fallback(12, 0.0, DetectionOutcome.EXTENSION));
        metrics.recordPhaseOutcome(Phase.PREPARATION, DetectionOutcome.notFound(0.1));

        assertThat(registry.get("strokecoach.analysis.phase").tag("phase", "impact")
                .tag("kind", "detected").tag("method", "biomechanical").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("strokecoach.analysis.phase").tag("phase", "impact")
                .tag("kind", "fallback").tag("method", "extension").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("strokecoach.analysis.phase").tag("phase", "preparation")
                .tag("kind", "not_found").counter().count()).isEqualTo(1.0);
    }

    @Test
    void comparisonAndFailureCounters() {
        metrics.recordComparison("serve", true);
        metrics.recordComparison("serve", false);
        metrics.recordComparison("serve", false);
        metrics.incrementFailure("timeout");

        assertThat(registry.get("strokecoach.analysis.comparison").tag("result", "matched").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("strokecoach.analysis.comparison").tag("result", "no_reference").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("strokecoach.analysis.failure").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }
}
