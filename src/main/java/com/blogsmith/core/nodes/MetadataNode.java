package com.blogsmith.core.nodes;

import com.blogsmith.core.collab.MetadataAnnotator;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that derives post metadata from the formatted content.
 */
@Component
public class MetadataNode {

    private static final Logger log = LoggerFactory.getLogger(MetadataNode.class);

    private final MetadataAnnotator annotator;

    public MetadataNode(MetadataAnnotator annotator) {
        this.annotator = annotator;
    }

    public Map<String, Object> apply(PipelineState state, RunContext run) {
        String content = state.finalContent();
        String instructions = state.instructions();
        ArticleMetadata metadata = run.stages().invoke(PipelineTopology.METADATA,
                () -> annotator.annotate(content, instructions));
        log.info("Metadata ready: title='{}', {} tag(s)", metadata.title(), metadata.tags().size());
        return StateUpdate.create().metadata(metadata).toMap();
    }
}
