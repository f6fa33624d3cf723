package com.blogsmith.core.model;

import java.io.Serializable;

/**
 * Result of a single quality check.
 *
 * @param type      which check produced this result
 * @param passed    whether the content met the threshold
 * @param measured  the measured value (word count, link count, heading count, structural issue count)
 * @param threshold the value the check compared against
 * @param message   human-readable description, phrased as an instruction when the check failed
 */
public record QualityCheck(
    QualityCheckType type,
    boolean passed,
    int measured,
    int threshold,
    String message
) implements Serializable {}
