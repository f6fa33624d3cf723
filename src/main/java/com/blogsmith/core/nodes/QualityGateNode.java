package com.blogsmith.core.nodes;

import com.blogsmith.core.gate.GateDecision;
import com.blogsmith.core.gate.QualityGate;
import com.blogsmith.core.graph.PipelineTopology;
import com.blogsmith.core.stage.RunContext;
import com.blogsmith.core.state.PipelineState;
import com.blogsmith.core.state.StateUpdate;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * LangGraph4j node that runs the quality gate and records its decision.
 * <p>
 * The only writer of {@code approvalStatus}. Feedback is replaced on every evaluation and is
 * empty on approval. A forced publish also records the disclosure note and a warning.
 */
@Component
public class QualityGateNode {

    private final QualityGate qualityGate;

    public QualityGateNode(QualityGate qualityGate) {
        this.qualityGate = qualityGate;
    }

    public Map<String, Object> apply(PipelineState state, RunContext run) {
        run.cancellation().throwIfCancelled(PipelineTopology.QUALITY_GATE);

        var config = run.config();
        GateDecision decision = qualityGate.evaluate(state, config.thresholds(), config.maxRevisions());

        var update = StateUpdate.create()
                .approvalStatus(decision.status())
                .feedback(decision.feedback())
                .qualityChecks(decision.checks());
        if (decision instanceof GateDecision.ForcePublished forced) {
            update.forcedNote(forced.disclosureNote())
                    .warning("Published after %d revision(s) with %d failing quality check(s): %s"
                            .formatted(state.revisionCount(), forced.feedback().size(),
                                    String.join(" | ", forced.feedbackMessages())));
        }
        return update.toMap();
    }
}
