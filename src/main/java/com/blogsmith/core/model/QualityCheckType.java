package com.blogsmith.core.model;

/**
 * The measurable checks run by the quality gate, in evaluation order.
 */
public enum QualityCheckType {
    WORD_COUNT,
    INLINE_LINKS,
    SINGLE_H1,
    SECTIONS,
    STRUCTURE
}
