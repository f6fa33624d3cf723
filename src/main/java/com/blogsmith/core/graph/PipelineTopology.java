package com.blogsmith.core.graph;

import java.util.List;

/**
 * The fixed shape of the pipeline: a linear chain ending at the quality gate, plus exactly
 * one feedback edge from the gate back to drafting.
 * <pre>
 *   START -> research -> draft -> format -> metadata -> quality_gate
 *         -> [routeAfterGate]
 *            -> publish -> END        (approved, force_published)
 *            -> revise -> draft       (rejected)
 * </pre>
 */
public final class PipelineTopology {

    public static final String RESEARCH = "research";
    public static final String DRAFT = "draft";
    public static final String FORMAT = "format";
    public static final String METADATA = "metadata";
    public static final String QUALITY_GATE = "quality_gate";
    public static final String REVISE = "revise";
    public static final String PUBLISH = "publish";

    public static final String START_LABEL = "start";
    public static final String END_LABEL = "end";

    /** Stages in first-pass order. */
    public static final List<String> STAGES = List.of(RESEARCH, DRAFT, FORMAT, METADATA, QUALITY_GATE, PUBLISH);

    /**
     * @param from        source stage
     * @param to          target stage
     * @param condition   the gate outcome selecting this edge, or {@code null} for an unconditional edge
     */
    public record Edge(String from, String to, String condition) {

        public boolean conditional() {
            return condition != null;
        }
    }

    public static final List<Edge> EDGES = List.of(
            new Edge(START_LABEL, RESEARCH, null),
            new Edge(RESEARCH, DRAFT, null),
            new Edge(DRAFT, FORMAT, null),
            new Edge(FORMAT, METADATA, null),
            new Edge(METADATA, QUALITY_GATE, null),
            new Edge(QUALITY_GATE, PUBLISH, "approved / force_published"),
            new Edge(QUALITY_GATE, REVISE, "rejected"),
            new Edge(REVISE, DRAFT, null),
            new Edge(PUBLISH, END_LABEL, null));

    private PipelineTopology() {}
}
