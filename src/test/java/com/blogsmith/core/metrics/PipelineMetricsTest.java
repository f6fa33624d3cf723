package com.blogsmith.core.metrics;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.RunOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    @DisplayName("recordStageDuration creates a timer per stage")
    void stageDuration() {
        metrics.recordStageDuration("draft", 1500);
        metrics.recordStageDuration("draft", 500);

        var timer = registry.find("blogsmith.stage.duration").tag("stage", "draft").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordGateDecision counts by decision")
    void gateDecisions() {
        metrics.recordGateDecision(ApprovalStatus.REJECTED);
        metrics.recordGateDecision(ApprovalStatus.REJECTED);
        metrics.recordGateDecision(ApprovalStatus.FORCE_PUBLISHED);

        assertEquals(2.0, registry.find("blogsmith.gate.decisions").tag("decision", "rejected").counter().count());
        assertEquals(1.0, registry.find("blogsmith.gate.decisions").tag("decision", "force_published").counter().count());
    }

    @Test
    @DisplayName("recordRunResult counts outcomes and times runs")
    void runResult() {
        metrics.recordRunResult(RunOutcome.FAILED, 42);

        assertEquals(1.0, registry.find("blogsmith.runs.total").tag("outcome", "failed").counter().count());
        assertEquals(1, registry.find("blogsmith.run.duration").tag("outcome", "failed").timer().count());
    }

    @Test
    @DisplayName("recordRevisionDepth feeds a distribution summary")
    void revisionDepth() {
        metrics.recordRevisionDepth(2);
        metrics.recordRevisionDepth(0);

        var summary = registry.find("blogsmith.revision.depth").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(2.0, summary.totalAmount());
    }
}
