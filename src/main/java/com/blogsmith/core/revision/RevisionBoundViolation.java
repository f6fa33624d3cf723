package com.blogsmith.core.revision;

/**
 * Raised when the revision loop is driven past its configured bound, or re-entered without a
 * rejection. Signals a defect in the routing logic, never a user-facing condition.
 */
public class RevisionBoundViolation extends IllegalStateException {

    public RevisionBoundViolation(String message) {
        super(message);
    }
}
