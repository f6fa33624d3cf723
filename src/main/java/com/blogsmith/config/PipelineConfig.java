package com.blogsmith.config;

import com.blogsmith.core.gate.GateThresholds;

import java.time.Duration;

/**
 * Immutable configuration of one pipeline run, threaded explicitly into the graph and the
 * quality gate. No stage reads global configuration.
 */
public record PipelineConfig(
    GateThresholds thresholds,
    int maxRevisions,
    boolean publishAsDraft,
    String tone,
    String instructions,
    Duration stageTimeout
) {

    public static final int DEFAULT_MAX_REVISIONS = 3;
    public static final Duration DEFAULT_STAGE_TIMEOUT = Duration.ofMinutes(5);

    public PipelineConfig {
        if (thresholds == null) {
            thresholds = GateThresholds.defaults();
        }
        tone = tone == null ? "" : tone;
        instructions = instructions == null ? "" : instructions;
        if (stageTimeout == null) {
            stageTimeout = DEFAULT_STAGE_TIMEOUT;
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(GateThresholds.defaults(), DEFAULT_MAX_REVISIONS, true,
                "professional and informative", "", DEFAULT_STAGE_TIMEOUT);
    }

    /**
     * Builds the run configuration from application properties; command-line overrides win.
     */
    public static PipelineConfig from(BlogsmithProperties properties, RunOptions options) {
        var gate = properties.getGate();
        var thresholds = new GateThresholds(gate.getMinWordCount(), gate.getMinInlineLinks(), gate.getMinSections());
        if (options.wordCount() != null) {
            thresholds = thresholds.withMinWordCount(options.wordCount());
        }
        String tone = isBlank(options.tone()) ? properties.getContent().getTone() : options.tone();
        String instructions = isBlank(options.instructions())
                ? properties.getContent().getInstructions() : options.instructions();
        return new PipelineConfig(
                thresholds,
                gate.getMaxRevisions(),
                properties.getPublish().isDraft(),
                tone,
                instructions,
                properties.getPipeline().getStageTimeout());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
