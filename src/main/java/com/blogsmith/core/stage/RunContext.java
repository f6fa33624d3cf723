package com.blogsmith.core.stage;

import com.blogsmith.config.PipelineConfig;

/**
 * Per-run values bound into the graph's nodes when the graph is compiled for a run.
 */
public record RunContext(
    String runId,
    PipelineConfig config,
    StageRunner stages
) {

    public RunCancellation cancellation() {
        return stages.cancellation();
    }
}
