package com.blogsmith.core.revision;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the bound on the revision loop and the hand-off from a rejection back to drafting.
 * <p>
 * The only writer of {@code revisionCount}. Each call advances the counter by exactly one;
 * {@code feedback} is left as the gate wrote it so the next draft sees every failing check.
 */
@Component
public class RevisionController {

    private static final Logger log = LoggerFactory.getLogger(RevisionController.class);

    /**
     * @throws RevisionBoundViolation if the state is not rejected, or the bound is already reached
     */
    public StateUpdate advance(PipelineState state, int maxRevisions) {
        int current = state.revisionCount();
        if (state.approvalStatus() != ApprovalStatus.REJECTED) {
            throw new RevisionBoundViolation(
                    "Revision requested while approval status is " + state.approvalStatus());
        }
        if (current >= maxRevisions) {
            throw new RevisionBoundViolation(
                    "Revision %d requested but the maximum is %d".formatted(current + 1, maxRevisions));
        }
        int next = current + 1;
        log.info("Starting revision {}/{} with {} failing check(s)", next, maxRevisions, state.feedback().size());
        return StateUpdate.create().revisionCount(next);
    }
}
