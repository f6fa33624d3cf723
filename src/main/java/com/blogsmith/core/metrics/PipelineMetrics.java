package com.blogsmith.core.metrics;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for pipeline runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("blogsmith.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateDecision(ApprovalStatus status) {
        Counter.builder("blogsmith.gate.decisions")
                .description("Quality gate decisions by outcome")
                .tag("decision", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records how many revisions a finished run needed.
     */
    public void recordRevisionDepth(int depth) {
        DistributionSummary.builder("blogsmith.revision.depth")
                .register(registry)
                .record(depth);
    }

    public void recordRunResult(RunOutcome outcome, long ms) {
        Counter.builder("blogsmith.runs.total")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        Timer.builder("blogsmith.run.duration")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementNotificationFailures() {
        Counter.builder("blogsmith.notifications.failed")
                .description("Notification deliveries that failed after a successful publish")
                .register(registry)
                .increment();
    }
}
