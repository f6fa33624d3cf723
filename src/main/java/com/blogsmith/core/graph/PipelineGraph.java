package com.blogsmith.core.graph;

import com.blogsmith.config.PipelineConfig;
import com.blogsmith.core.logging.MdcContext;
import com.blogsmith.core.nodes.DraftNode;
import com.blogsmith.core.nodes.FormatNode;
import com.blogsmith.core.nodes.MetadataNode;
import com.blogsmith.core.nodes.PublishNode;
import com.blogsmith.core.nodes.QualityGateNode;
import com.blogsmith.core.nodes.ResearchNode;
import com.blogsmith.core.revision.RevisionController;
import com.blogsmith.core.stage.RunCancellation;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.stage.StageRunner;
import com.blogsmith.core.state.PipelineState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ExecutorService;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds the LangGraph4j {@link StateGraph} for the content pipeline.
 * <p>
 * A fresh graph is compiled per run so that the run's {@link PipelineConfig}, cancellation
 * token and stage runner are bound into the nodes; runs share no mutable state. See
 * {@link PipelineTopology} for the shape.
 */
@Component
public class PipelineGraph {

    private static final Logger log = LoggerFactory.getLogger(PipelineGraph.class);

    private final ResearchNode researchNode;
    private final DraftNode draftNode;
    private final FormatNode formatNode;
    private final MetadataNode metadataNode;
    private final QualityGateNode qualityGateNode;
    private final PublishNode publishNode;
    private final RevisionController revisionController;
    private final ExecutorService stageWorkers;

    public PipelineGraph(ResearchNode researchNode,
                         DraftNode draftNode,
                         FormatNode formatNode,
                         MetadataNode metadataNode,
                         QualityGateNode qualityGateNode,
                         PublishNode publishNode,
                         RevisionController revisionController,
                         @Qualifier("stageWorkers") ExecutorService stageWorkers) {
        this.researchNode = researchNode;
        this.draftNode = draftNode;
        this.formatNode = formatNode;
        this.metadataNode = metadataNode;
        this.qualityGateNode = qualityGateNode;
        this.publishNode = publishNode;
        this.revisionController = revisionController;
        this.stageWorkers = stageWorkers;
    }

    public CompiledGraph<PipelineState> compile(String runId, PipelineConfig config,
                                                RunCancellation cancellation) throws GraphStateException {
        var run = new RunContext(runId, config,
                new StageRunner(stageWorkers, config.stageTimeout(), cancellation));

        var graph = new StateGraph<>(PipelineState.SCHEMA, PipelineState::new)
                .addNode(PipelineTopology.RESEARCH, stage(run, PipelineTopology.RESEARCH,
                        state -> researchNode.apply(state, run)))
                .addNode(PipelineTopology.DRAFT, stage(run, PipelineTopology.DRAFT,
                        state -> draftNode.apply(state, run)))
                .addNode(PipelineTopology.FORMAT, stage(run, PipelineTopology.FORMAT,
                        state -> formatNode.apply(state, run)))
                .addNode(PipelineTopology.METADATA, stage(run, PipelineTopology.METADATA,
                        state -> metadataNode.apply(state, run)))
                .addNode(PipelineTopology.QUALITY_GATE, stage(run, PipelineTopology.QUALITY_GATE,
                        state -> qualityGateNode.apply(state, run)))
                .addNode(PipelineTopology.REVISE, stage(run, PipelineTopology.REVISE,
                        state -> revisionController.advance(state, config.maxRevisions()).toMap()))
                .addNode(PipelineTopology.PUBLISH, stage(run, PipelineTopology.PUBLISH,
                        state -> publishNode.apply(state, run)))
                .addEdge(START, PipelineTopology.RESEARCH)
                .addEdge(PipelineTopology.RESEARCH, PipelineTopology.DRAFT)
                .addEdge(PipelineTopology.DRAFT, PipelineTopology.FORMAT)
                .addEdge(PipelineTopology.FORMAT, PipelineTopology.METADATA)
                .addEdge(PipelineTopology.METADATA, PipelineTopology.QUALITY_GATE)
                .addConditionalEdges(PipelineTopology.QUALITY_GATE,
                        edge_async(this::routeAfterGate),
                        Map.of(PipelineTopology.PUBLISH, PipelineTopology.PUBLISH,
                                PipelineTopology.REVISE, PipelineTopology.REVISE))
                .addEdge(PipelineTopology.REVISE, PipelineTopology.DRAFT)
                .addEdge(PipelineTopology.PUBLISH, END);

        int recursionLimit = recursionLimit(config.maxRevisions());
        log.debug("Compiling pipeline graph for run {} (max revisions {}, recursion limit {})",
                runId, config.maxRevisions(), recursionLimit);
        return graph.compile(CompileConfig.builder()
                .recursionLimit(recursionLimit)
                .build());
    }

    /**
     * Routes after quality_gate. Approved and force-published content goes to publish;
     * rejected content loops back through revise.
     */
    String routeAfterGate(PipelineState state) {
        return switch (state.approvalStatus()) {
            case APPROVED, FORCE_PUBLISHED -> PipelineTopology.PUBLISH;
            case REJECTED -> PipelineTopology.REVISE;
            case PENDING -> throw new IllegalStateException("Quality gate finished without a decision");
        };
    }

    /**
     * Upper bound on graph steps: research, one draft/format/metadata/gate cycle per attempt,
     * one revise per rejection, publish. Padded so the bound is never what stops a run.
     */
    static int recursionLimit(int maxRevisions) {
        return 2 + 4 * (maxRevisions + 1) + maxRevisions + 10;
    }

    private static AsyncNodeAction<PipelineState> stage(RunContext run, String name,
                                                        NodeAction<PipelineState> action) {
        return node_async(state -> {
            MdcContext.setStage(run.runId(), name);
            try {
                Map<String, Object> update = action.apply(state);
                PipelineState.requireKnownFields(update);
                return update;
            } finally {
                MdcContext.clearStage();
            }
        });
    }
}
