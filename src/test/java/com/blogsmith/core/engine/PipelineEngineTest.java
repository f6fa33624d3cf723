package com.blogsmith.core.engine;

import com.blogsmith.core.events.EventBus;
import com.blogsmith.core.events.PipelineEvent;
import com.blogsmith.core.gate.Articles;
import com.blogsmith.core.graph.PipelineFixture;
import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.RunOutcome;
import com.blogsmith.core.revision.RevisionBoundViolation;
import com.blogsmith.core.stage.RunCancellation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PipelineEngineTest {

    private static final String GOOD = Articles.article(200, 6, 3);
    private static final String SHORT = Articles.article(100, 6, 3);

    private PipelineFixture fixture;
    private EventBus eventBus;
    private PipelineEngine engine;
    private List<PipelineEvent> events;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        engine = new PipelineEngine(fixture.graph, eventBus, fixture.metrics);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private List<String> eventTypes() {
        return events.stream().map(PipelineEvent::eventType).toList();
    }

    @Nested
    @DisplayName("successful runs")
    class Successful {

        @Test
        @DisplayName("approved run is PUBLISHED and emits lifecycle events")
        void approved() {
            when(fixture.drafts.generate(any())).thenReturn(GOOD);

            PipelineResult result = engine.run("Edge caching", PipelineFixture.config(3));

            assertEquals(RunOutcome.PUBLISHED, result.outcome());
            assertTrue(result.published());
            assertTrue(result.runId().startsWith("BLOG-"));
            assertEquals("run.started", eventTypes().get(0));
            assertTrue(eventTypes().contains("gate.approved"));
            assertEquals("run.published", eventTypes().get(eventTypes().size() - 1));
            assertEquals(1.0, fixture.registry.find("blogsmith.runs.total").tag("outcome", "published").counter().count());
        }

        @Test
        @DisplayName("force-published run still counts as published")
        void forcePublished() {
            when(fixture.drafts.generate(any())).thenReturn(SHORT);

            PipelineResult result = engine.run("Edge caching", PipelineFixture.config(1));

            assertEquals(RunOutcome.PUBLISHED, result.outcome());
            assertEquals(ApprovalStatus.FORCE_PUBLISHED, result.state().approvalStatus());
            assertFalse(result.state().warnings().isEmpty());
            assertTrue(eventTypes().contains("gate.rejected"));
            assertTrue(eventTypes().contains("gate.force_published"));
        }

        @Test
        @DisplayName("a failing notification only adds a warning")
        void notificationFailure() {
            when(fixture.drafts.generate(any())).thenReturn(GOOD);
            doThrow(new IllegalStateException("webhook down")).when(fixture.notifications).notifyPublished(any());

            PipelineResult result = engine.run("Edge caching", PipelineFixture.config(3));

            assertEquals(RunOutcome.PUBLISHED, result.outcome());
            assertTrue(result.state().warnings().stream().anyMatch(w -> w.contains("webhook down")));
            assertEquals(1.0, fixture.registry.find("blogsmith.notifications.failed").counter().count());
        }
    }

    @Nested
    @DisplayName("failed runs")
    class Failed {

        @Test
        @DisplayName("collaborator failure ends the run FAILED with earlier state preserved")
        void collaboratorFailure() {
            when(fixture.drafts.generate(any())).thenReturn(GOOD);
            when(fixture.annotator.annotate(anyString(), anyString())).thenThrow(new IllegalStateException("llm down"));

            PipelineResult result = engine.run("Edge caching", PipelineFixture.config(3));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertEquals(GOOD, result.state().draftContent());
            assertTrue(result.state().research().isPresent());
            assertTrue(result.state().errors().stream().anyMatch(e -> e.contains("llm down")));
            assertTrue(result.state().publication().isEmpty());
            verify(fixture.publishSink, never()).publish(any());
            assertEquals("run.failed", eventTypes().get(eventTypes().size() - 1));
        }

        @Test
        @DisplayName("publish failure fails the run")
        void publishFailure() {
            when(fixture.drafts.generate(any())).thenReturn(GOOD);
            when(fixture.publishSink.publish(any())).thenThrow(new IllegalStateException("ghost 500"));

            PipelineResult result = engine.run("Edge caching", PipelineFixture.config(3));

            assertEquals(RunOutcome.FAILED, result.outcome());
            assertTrue(result.state().errors().get(0).contains("ghost 500"));
        }

        @Test
        @DisplayName("graph-wrapped revision bound violations are unwrapped so they can propagate")
        void programmingErrorsPropagate() {
            assertInstanceOf(RevisionBoundViolation.class, PipelineEngine.significantCause(
                    new RuntimeException("wrapper", new RevisionBoundViolation("bad"))));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("a run cancelled mid-way never publishes")
        void cancelMidRun() {
            var cancellation = new RunCancellation();
            when(fixture.drafts.generate(any())).thenAnswer(inv -> {
                cancellation.cancel("operator abort");
                return GOOD;
            });

            PipelineResult result = engine.run("BLOG-CANCEL", "Edge caching", PipelineFixture.config(3), cancellation);

            assertEquals(RunOutcome.CANCELLED, result.outcome());
            assertTrue(result.state().warnings().stream().anyMatch(w -> w.contains("operator abort")));
            verify(fixture.publishSink, never()).publish(any());
            assertEquals("run.cancelled", eventTypes().get(eventTypes().size() - 1));
        }

        @Test
        @DisplayName("cancel returns false for unknown runs")
        void cancelUnknown() {
            assertFalse(engine.cancel("BLOG-NOPE", "x"));
        }
    }
}
