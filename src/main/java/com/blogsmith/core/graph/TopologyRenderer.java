package com.blogsmith.core.graph;

import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders {@link PipelineTopology} for {@code --visualize}, without compiling or running anything.
 * <p>
 * Conditional edges out of the quality gate are drawn dashed and labelled with the gate outcome.
 */
@Component
public class TopologyRenderer {

    public enum Format {
        MERMAID,
        TEXT;

        public static Format parse(String value) {
            return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public String render(Format format, int maxRevisions) {
        return switch (format) {
            case MERMAID -> mermaid(maxRevisions);
            case TEXT -> text(maxRevisions);
        };
    }

    String mermaid(int maxRevisions) {
        var sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");
        sb.append("    ").append(nodeId(PipelineTopology.START_LABEL)).append("([\"start\"])\n");
        for (String stage : PipelineTopology.STAGES) {
            sb.append("    ").append(nodeId(stage)).append(shape(stage)).append('\n');
        }
        sb.append("    ").append(nodeId(PipelineTopology.REVISE))
                .append("[\"revise (max ").append(maxRevisions).append(")\"]\n");
        sb.append("    ").append(nodeId(PipelineTopology.END_LABEL)).append("([\"end\"])\n\n");

        for (PipelineTopology.Edge edge : PipelineTopology.EDGES) {
            sb.append("  ").append(nodeId(edge.from()));
            if (edge.conditional()) {
                sb.append(" -.->|").append(edge.condition()).append("| ");
            } else {
                sb.append(" --> ");
            }
            sb.append(nodeId(edge.to())).append('\n');
        }
        sb.append("```\n");
        return sb.toString();
    }

    String text(int maxRevisions) {
        var sb = new StringBuilder();
        sb.append("Pipeline topology (max revisions: ").append(maxRevisions).append(")\n\n");
        for (PipelineTopology.Edge edge : PipelineTopology.EDGES) {
            sb.append("  ").append(String.format("%-13s", edge.from()));
            sb.append(edge.conditional() ? " ..> " : " --> ");
            sb.append(edge.to());
            if (edge.conditional()) {
                sb.append("   [").append(edge.condition()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String shape(String stage) {
        return PipelineTopology.QUALITY_GATE.equals(stage)
                ? "{\"" + stage + "\"}"
                : "[\"" + stage + "\"]";
    }

    // "end" is a reserved word in Mermaid flowcharts
    private static String nodeId(String name) {
        return "node_" + name;
    }
}
