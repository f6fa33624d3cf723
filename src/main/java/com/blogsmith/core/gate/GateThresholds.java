package com.blogsmith.core.gate;

/**
 * Thresholds the quality gate compares measured content against.
 *
 * @param minWordCount   minimum number of words
 * @param minInlineLinks minimum number of inline reference links
 * @param minSections    minimum number of second-level section headings
 */
public record GateThresholds(
    int minWordCount,
    int minInlineLinks,
    int minSections
) {

    public static final int DEFAULT_MIN_WORD_COUNT = 3500;
    public static final int DEFAULT_MIN_INLINE_LINKS = 10;
    public static final int DEFAULT_MIN_SECTIONS = 4;

    public static GateThresholds defaults() {
        return new GateThresholds(DEFAULT_MIN_WORD_COUNT, DEFAULT_MIN_INLINE_LINKS, DEFAULT_MIN_SECTIONS);
    }

    public GateThresholds withMinWordCount(int minWordCount) {
        return new GateThresholds(minWordCount, minInlineLinks, minSections);
    }
}
