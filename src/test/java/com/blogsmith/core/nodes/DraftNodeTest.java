package com.blogsmith.core.nodes;

import com.blogsmith.config.PipelineConfig;
import com.blogsmith.core.collab.DraftRequest;
import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.QualityCheckType;
import com.blogsmith.core.model.ResearchSummary;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DraftNodeTest {

    private final PipelineConfig config = PipelineConfig.defaults();
    private final ResearchSummary research = new ResearchSummary("brief", List.of("https://a.example"));

    @Test
    @DisplayName("first pass asks for an initial draft")
    void initialDraft() {
        var state = PipelineState.merge(PipelineState.initial("Topic", "casual", "Use examples"),
                StateUpdate.create().research(research));

        var request = assertInstanceOf(DraftRequest.InitialDraft.class, DraftNode.requestFor(state, config));
        assertEquals("Topic", request.topic());
        assertEquals("casual", request.tone());
        assertEquals("Use examples", request.instructions());
        assertEquals(research, request.research());
        assertEquals(config.thresholds(), request.targets());
    }

    @Test
    @DisplayName("after a rejection asks for a revision of the judged content with the gate's feedback")
    void revisionDraft() {
        var feedback = List.of(new QualityCheck(QualityCheckType.INLINE_LINKS, false, 2, 10, "add links"));
        var state = PipelineState.merge(PipelineState.initial("Topic", null, null),
                StateUpdate.create()
                        .research(research)
                        .draftContent("raw draft")
                        .formattedContent("formatted draft")
                        .approvalStatus(ApprovalStatus.REJECTED)
                        .feedback(feedback)
                        .revisionCount(2));

        var request = assertInstanceOf(DraftRequest.RevisionDraft.class, DraftNode.requestFor(state, config));
        assertEquals(2, request.revisionCount());
        assertEquals("formatted draft", request.previousDraft());
        assertEquals(feedback, request.feedback());
    }
}
