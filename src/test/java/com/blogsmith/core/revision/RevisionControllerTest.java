package com.blogsmith.core.revision;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.QualityCheckType;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RevisionControllerTest {

    private final RevisionController controller = new RevisionController();
    private final QualityCheck wordCount =
            new QualityCheck(QualityCheckType.WORD_COUNT, false, 3000, 3500, "expand");

    private PipelineState rejectedAt(int revisionCount) {
        return PipelineState.merge(PipelineState.initial("topic", null, null),
                StateUpdate.create()
                        .revisionCount(revisionCount)
                        .approvalStatus(ApprovalStatus.REJECTED)
                        .feedback(List.of(wordCount)));
    }

    @Test
    @DisplayName("advances the revision count by exactly one and leaves feedback alone")
    void advancesByOne() {
        var update = controller.advance(rejectedAt(0), 3).toMap();

        assertEquals(1, update.get(PipelineState.REVISION_COUNT));
        assertFalse(update.containsKey(PipelineState.FEEDBACK));
        assertFalse(update.containsKey(PipelineState.APPROVAL_STATUS));
    }

    @Test
    @DisplayName("three consecutive rejections produce revisions 1, 2, 3")
    void sequence() {
        var state = rejectedAt(0);
        var seen = new ArrayList<Integer>();
        for (int i = 0; i < 3; i++) {
            state = PipelineState.merge(state, controller.advance(state, 3));
            seen.add(state.revisionCount());
        }
        assertEquals(List.of(1, 2, 3), seen);
    }

    @Test
    @DisplayName("refuses to advance at the bound")
    void atBound() {
        assertThrows(RevisionBoundViolation.class, () -> controller.advance(rejectedAt(3), 3));
    }

    @Test
    @DisplayName("refuses to advance a state that was not rejected")
    void notRejected() {
        var approved = PipelineState.merge(rejectedAt(0),
                StateUpdate.create().approvalStatus(ApprovalStatus.APPROVED));
        assertThrows(RevisionBoundViolation.class, () -> controller.advance(approved, 3));
    }
}
