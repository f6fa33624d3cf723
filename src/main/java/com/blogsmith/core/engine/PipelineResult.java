package com.blogsmith.core.engine;

import com.blogsmith.core.model.RunOutcome;
import com.blogsmith.core.state.PipelineState;

import java.time.Duration;

/**
 * Final state and outcome of a pipeline run. For failed and cancelled runs the state is the
 * last one the pipeline reached, with the cause appended to its errors or warnings.
 */
public record PipelineResult(
    String runId,
    PipelineState state,
    RunOutcome outcome,
    Duration elapsed
) {

    public boolean published() {
        return outcome == RunOutcome.PUBLISHED;
    }
}
