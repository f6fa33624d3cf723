package com.blogsmith.core.nodes;

import com.blogsmith.core.collab.ContentFormatter;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that normalizes the latest draft.
 */
@Component
public class FormatNode {

    private static final Logger log = LoggerFactory.getLogger(FormatNode.class);

    private final ContentFormatter formatter;

    public FormatNode(ContentFormatter formatter) {
        this.formatter = formatter;
    }

    public Map<String, Object> apply(PipelineState state, RunContext run) {
        String draft = state.draftContent();
        String formatted = run.stages().invoke(PipelineTopology.FORMAT, () -> formatter.format(draft));
        log.debug("Formatted content: {} -> {} chars", draft.length(), formatted.length());
        return StateUpdate.create().formattedContent(formatted).toMap();
    }
}
