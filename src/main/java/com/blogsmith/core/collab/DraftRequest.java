package com.blogsmith.core.collab;

import com.blogsmith.core.gate.GateThresholds;
import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.ResearchSummary;

import java.util.List;

/**
 * Input to the {@link DraftGenerator}. The pipeline picks the variant: {@link InitialDraft}
 * on the first pass, {@link RevisionDraft} once the quality gate has rejected a draft.
 */
public sealed interface DraftRequest permits DraftRequest.InitialDraft, DraftRequest.RevisionDraft {

    String topic();

    String tone();

    String instructions();

    ResearchSummary research();

    /** The thresholds the draft will be judged against. */
    GateThresholds targets();

    record InitialDraft(
        String topic,
        String tone,
        String instructions,
        ResearchSummary research,
        GateThresholds targets
    ) implements DraftRequest {}

    /**
     * @param previousDraft the draft the gate rejected
     * @param feedback      every failing check of that evaluation, in check order
     * @param revisionCount the revision this request produces (1 for the first revision)
     */
    record RevisionDraft(
        String topic,
        String tone,
        String instructions,
        ResearchSummary research,
        GateThresholds targets,
        String previousDraft,
        List<QualityCheck> feedback,
        int revisionCount
    ) implements DraftRequest {

        public RevisionDraft {
            feedback = List.copyOf(feedback);
        }
    }
}
