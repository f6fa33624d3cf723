package com.blogsmith.core.engine;

import com.blogsmith.config.PipelineConfig;
import com.blogsmith.core.events.EventBus;
import com.blogsmith.core.events.PipelineEvent;
import com.blogsmith.core.graph.PipelineGraph;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.logging.MdcContext;
import com.blogsmith.core.metrics.PipelineMetrics;
import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.RunOutcome;
import com.blogsmith.core.revision.RevisionBoundViolation;
import com.blogsmith.core.stage.ExternalServiceException;
import com.blogsmith.core.stage.RunCancellation;
import com.blogsmith.core.stage.RunCancelledException;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import com.blogsmith.core.state.UnknownStateFieldException;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.NodeOutput;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a pipeline run through the compiled LangGraph4j graph.
 * <p>
 * Creates the entry state from the topic and the run configuration, streams the graph step
 * by step, and turns the result into a {@link PipelineResult}. A collaborator failure ends
 * the run as {@link RunOutcome#FAILED} with the last reached state preserved; a cancelled run
 * ends as {@link RunOutcome#CANCELLED} without publishing. Programming errors
 * ({@link RevisionBoundViolation}, {@link UnknownStateFieldException}) propagate.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final PipelineGraph pipelineGraph;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final Map<String, RunCancellation> activeRuns = new ConcurrentHashMap<>();

    public PipelineEngine(PipelineGraph pipelineGraph, EventBus eventBus, PipelineMetrics metrics) {
        this.pipelineGraph = pipelineGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs the pipeline for a topic, generating a new run ID.
     */
    public PipelineResult run(String topic, PipelineConfig config) {
        return run(generateRunId(), topic, config, new RunCancellation());
    }

    /**
     * Runs the pipeline for a topic.
     *
     * @param runId        the run ID, used for logging, events and the graph thread
     * @param topic        the article topic
     * @param config       thresholds, revision bound and overrides for this run
     * @param cancellation token checked at every stage boundary
     * @return the final state and outcome; never {@code null}
     */
    public PipelineResult run(String runId, String topic, PipelineConfig config, RunCancellation cancellation) {
        MdcContext.setRun(runId);
        activeRuns.put(runId, cancellation);
        long start = System.currentTimeMillis();
        PipelineState last = PipelineState.initial(topic, config.tone(), config.instructions());
        RunOutcome outcome;
        try {
            log.info("Starting run {} (min words {}, min links {}, min sections {}, max revisions {}, draft={}) for topic: {}",
                    runId, config.thresholds().minWordCount(), config.thresholds().minInlineLinks(),
                    config.thresholds().minSections(), config.maxRevisions(), config.publishAsDraft(), topic);
            eventBus.publish(PipelineEvent.of("run.started", runId, null,
                    Map.of("topic", topic, "maxRevisions", config.maxRevisions())));

            var graph = pipelineGraph.compile(runId, config, cancellation);
            var runnableConfig = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            long stepStart = System.currentTimeMillis();
            for (NodeOutput<PipelineState> output : graph.stream(last.data(), runnableConfig)) {
                last = output.state();
                String node = output.node();
                if (StateGraph.START.equals(node) || StateGraph.END.equals(node)) {
                    continue;
                }
                long stepMs = System.currentTimeMillis() - stepStart;
                stepStart = System.currentTimeMillis();
                onStageCompleted(runId, node, last, stepMs);
                if (!PipelineTopology.PUBLISH.equals(node)) {
                    cancellation.throwIfCancelled("step after " + node);
                }
            }

            if (last.publication().isPresent()) {
                outcome = RunOutcome.PUBLISHED;
            } else {
                outcome = RunOutcome.FAILED;
                last = PipelineState.merge(last, StateUpdate.create().error("Pipeline ended without publishing"));
            }
        } catch (Exception e) {
            Throwable cause = significantCause(e);
            if (cause instanceof RevisionBoundViolation violation) {
                throw violation;
            }
            if (cause instanceof UnknownStateFieldException unknownField) {
                throw unknownField;
            }
            if (cause instanceof RunCancelledException || cancellation.isCancelled()) {
                outcome = RunOutcome.CANCELLED;
                String reason = cancellation.isCancelled() ? cancellation.reason() : describe(cause);
                log.warn("Run {} cancelled: {}", runId, reason);
                last = PipelineState.merge(last, StateUpdate.create().warning("Run cancelled: " + reason));
            } else {
                outcome = RunOutcome.FAILED;
                log.error("Run {} failed: {}", runId, describe(cause), cause);
                last = PipelineState.merge(last, StateUpdate.create().error(describe(cause)));
            }
        } finally {
            activeRuns.remove(runId);
        }

        try {
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordRunResult(outcome, elapsed);
            metrics.recordRevisionDepth(last.revisionCount());
            publishOutcome(runId, outcome, last);
            log.info("Run {} finished: {} after {} revision(s) in {}s", runId, outcome, last.revisionCount(),
                    String.format(Locale.ROOT, "%.1f", elapsed / 1000.0));
            return new PipelineResult(runId, last, outcome, Duration.ofMillis(elapsed));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Requests cancellation of a running pipeline. The run stops at its next stage boundary.
     *
     * @return {@code true} if a run with that ID was active
     */
    public boolean cancel(String runId, String reason) {
        RunCancellation cancellation = activeRuns.get(runId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel(reason);
        return true;
    }

    @PreDestroy
    public void cancelAll() {
        if (!activeRuns.isEmpty()) {
            log.warn("Shutting down with {} active run(s); cancelling", activeRuns.size());
        }
        activeRuns.values().forEach(c -> c.cancel("shutdown"));
    }

    /**
     * Generates a unique run ID in the format BLOG-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("BLOG-%d-%04d", year, count);
    }

    private void onStageCompleted(String runId, String node, PipelineState state, long stepMs) {
        metrics.recordStageDuration(node, stepMs);
        eventBus.publish(PipelineEvent.of("stage.completed", runId, node,
                Map.of("revisionCount", state.revisionCount(), "durationMs", stepMs)));

        if (PipelineTopology.QUALITY_GATE.equals(node)) {
            ApprovalStatus status = state.approvalStatus();
            metrics.recordGateDecision(status);
            var failing = state.feedback().stream().map(QualityCheck::type).map(Enum::name).toList();
            eventBus.publish(PipelineEvent.of("gate." + status.name().toLowerCase(Locale.ROOT), runId, node,
                    Map.of("revisionCount", state.revisionCount(), "failingChecks", failing)));
        }
    }

    private void publishOutcome(String runId, RunOutcome outcome, PipelineState state) {
        var payload = new HashMap<String, Object>();
        payload.put("revisionCount", state.revisionCount());
        payload.put("approvalStatus", state.approvalStatus().name());
        state.publication().ifPresent(p -> payload.put("url", p.url()));
        if (!state.errors().isEmpty()) {
            payload.put("errors", state.errors());
        }
        eventBus.publish(PipelineEvent.of("run." + outcome.name().toLowerCase(Locale.ROOT), runId, null, payload));
    }

    /**
     * LangGraph4j wraps node failures; find the exception that explains the failure.
     */
    static Throwable significantCause(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof RevisionBoundViolation
                    || current instanceof UnknownStateFieldException
                    || current instanceof RunCancelledException
                    || current instanceof ExternalServiceException) {
                return current;
            }
            current = current.getCause();
        }
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
