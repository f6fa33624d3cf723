package com.blogsmith.core.nodes;

import com.blogsmith.core.collab.ResearchProvider;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.model.ResearchSummary;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that gathers research for the topic. Runs once per run; revision loops
 * re-enter at the draft stage.
 */
@Component
public class ResearchNode {

    private static final Logger log = LoggerFactory.getLogger(ResearchNode.class);

    private final ResearchProvider researchProvider;

    public ResearchNode(ResearchProvider researchProvider) {
        this.researchProvider = researchProvider;
    }

    public Map<String, Object> apply(PipelineState state, RunContext run) {
        String topic = state.topic();
        log.info("Researching topic: {}", topic);
        ResearchSummary research = run.stages().invoke(PipelineTopology.RESEARCH,
                () -> researchProvider.research(topic));
        log.info("Research complete: {} source(s), {} chars of summary",
                research.sources().size(), research.summary().length());
        return StateUpdate.create().research(research).toMap();
    }
}
