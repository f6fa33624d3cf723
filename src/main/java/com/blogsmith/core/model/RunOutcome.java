package com.blogsmith.core.model;

/**
 * Terminal result of a pipeline run.
 */
public enum RunOutcome {
    PUBLISHED,
    FAILED,
    CANCELLED
}
