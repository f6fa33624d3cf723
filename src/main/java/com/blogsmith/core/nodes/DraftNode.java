package com.blogsmith.core.nodes;

import com.blogsmith.config.PipelineConfig;
import com.blogsmith.core.collab.DraftGenerator;
import com.blogsmith.core.collab.DraftRequest;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.model.ResearchSummary;
import com.blogsmith.core.stage.ExternalServiceException;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that writes the article.
 * <p>
 * On the first pass ({@code revisionCount == 0}) it sends an {@link DraftRequest.InitialDraft};
 * after a rejection it sends a {@link DraftRequest.RevisionDraft} carrying the rejected draft
 * and the gate's latest feedback.
 */
@Component
public class DraftNode {

    private static final Logger log = LoggerFactory.getLogger(DraftNode.class);

    private final DraftGenerator draftGenerator;

    public DraftNode(DraftGenerator draftGenerator) {
        this.draftGenerator = draftGenerator;
    }

    public Map<String, Object> apply(PipelineState state, RunContext run) {
        DraftRequest request = requestFor(state, run.config());
        if (request instanceof DraftRequest.RevisionDraft revision) {
            log.info("Writing revision {} addressing {} failing check(s)",
                    revision.revisionCount(), revision.feedback().size());
        } else {
            log.info("Writing initial draft (target {} words)", request.targets().minWordCount());
        }

        String draft = run.stages().invoke(PipelineTopology.DRAFT, () -> draftGenerator.generate(request));
        if (draft.isBlank()) {
            throw new ExternalServiceException(PipelineTopology.DRAFT, "draft generator returned empty content");
        }
        log.info("Draft ready ({} chars)", draft.length());
        return StateUpdate.create().draftContent(draft).toMap();
    }

    static DraftRequest requestFor(PipelineState state, PipelineConfig config) {
        ResearchSummary research = state.research().orElseGet(() -> new ResearchSummary("", List.of()));
        if (state.revisionCount() == 0) {
            return new DraftRequest.InitialDraft(
                    state.topic(), state.tone(), state.instructions(), research, config.thresholds());
        }
        return new DraftRequest.RevisionDraft(
                state.topic(), state.tone(), state.instructions(), research, config.thresholds(),
                state.finalContent(), state.feedback(), state.revisionCount());
    }
}
