package com.blogsmith.core.gate;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.QualityCheck;

import java.util.List;

/**
 * Three-way result of a quality gate evaluation.
 * <p>
 * {@link #checks()} always holds every check result in evaluation order;
 * {@link #feedback()} holds only the failing ones.
 */
public sealed interface GateDecision
        permits GateDecision.Approved, GateDecision.Rejected, GateDecision.ForcePublished {

    ApprovalStatus status();

    List<QualityCheck> checks();

    List<QualityCheck> feedback();

    default List<String> feedbackMessages() {
        return feedback().stream().map(QualityCheck::message).toList();
    }

    /** Every check passed. */
    record Approved(List<QualityCheck> checks) implements GateDecision {

        public Approved {
            checks = List.copyOf(checks);
        }

        @Override
        public ApprovalStatus status() {
            return ApprovalStatus.APPROVED;
        }

        @Override
        public List<QualityCheck> feedback() {
            return List.of();
        }
    }

    /** At least one check failed and another revision is allowed. */
    record Rejected(List<QualityCheck> checks, List<QualityCheck> feedback) implements GateDecision {

        public Rejected {
            checks = List.copyOf(checks);
            feedback = List.copyOf(feedback);
        }

        @Override
        public ApprovalStatus status() {
            return ApprovalStatus.REJECTED;
        }
    }

    /**
     * At least one check failed and the revision budget is spent. The content is published
     * with {@link #disclosureNote()} prepended.
     */
    record ForcePublished(List<QualityCheck> checks, List<QualityCheck> feedback, String disclosureNote)
            implements GateDecision {

        public ForcePublished {
            checks = List.copyOf(checks);
            feedback = List.copyOf(feedback);
        }

        @Override
        public ApprovalStatus status() {
            return ApprovalStatus.FORCE_PUBLISHED;
        }
    }
}
