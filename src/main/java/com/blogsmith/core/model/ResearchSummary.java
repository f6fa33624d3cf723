package com.blogsmith.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Synthesized research brief for a topic, with the source URLs it was built from (in citation order).
 */
public record ResearchSummary(
    String summary,
    List<String> sources
) implements Serializable {

    public ResearchSummary {
        summary = summary == null ? "" : summary;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
