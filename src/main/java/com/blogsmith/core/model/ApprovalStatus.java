package com.blogsmith.core.model;

/**
 * Outcome of the latest quality gate evaluation.
 * <p>
 * A run starts at {@link #PENDING}; only the quality gate stage moves it to one of the
 * three decided values. {@link #REJECTED} is never terminal.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    FORCE_PUBLISHED
}
