package com.blogsmith.core.state;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.model.PublishResult;
import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.ResearchSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed partial update for {@link PipelineState}.
 * <p>
 * Each state field has its own setter, so a misspelled field is a compile error.
 * Fields that are never set are absent from {@link #toMap()} and therefore carried over
 * unchanged by {@link PipelineState#merge(PipelineState, StateUpdate)}.
 * The topic is deliberately missing: it is set once at entry.
 */
public final class StateUpdate {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private StateUpdate() {}

    public static StateUpdate create() {
        return new StateUpdate();
    }

    public StateUpdate research(ResearchSummary research) {
        return put(PipelineState.RESEARCH, research);
    }

    public StateUpdate draftContent(String draft) {
        return put(PipelineState.DRAFT_CONTENT, draft);
    }

    public StateUpdate formattedContent(String formatted) {
        return put(PipelineState.FORMATTED_CONTENT, formatted);
    }

    public StateUpdate metadata(ArticleMetadata metadata) {
        return put(PipelineState.METADATA, metadata);
    }

    public StateUpdate revisionCount(int revisionCount) {
        return put(PipelineState.REVISION_COUNT, revisionCount);
    }

    public StateUpdate approvalStatus(ApprovalStatus status) {
        return put(PipelineState.APPROVAL_STATUS, Objects.requireNonNull(status, "status").name());
    }

    public StateUpdate feedback(List<QualityCheck> feedback) {
        return put(PipelineState.FEEDBACK, List.copyOf(feedback));
    }

    public StateUpdate qualityChecks(List<QualityCheck> checks) {
        return put(PipelineState.QUALITY_CHECKS, List.copyOf(checks));
    }

    public StateUpdate forcedNote(String note) {
        return put(PipelineState.FORCED_NOTE, note);
    }

    public StateUpdate publication(PublishResult publication) {
        return put(PipelineState.PUBLICATION, publication);
    }

    public StateUpdate error(String message) {
        errors.add(Objects.requireNonNull(message, "message"));
        return this;
    }

    public StateUpdate warning(String message) {
        warnings.add(Objects.requireNonNull(message, "message"));
        return this;
    }

    public boolean isEmpty() {
        return values.isEmpty() && errors.isEmpty() && warnings.isEmpty();
    }

    /**
     * Returns the update in the raw form LangGraph4j nodes hand back to the graph.
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>(values);
        if (!errors.isEmpty()) {
            map.put(PipelineState.ERRORS, List.copyOf(errors));
        }
        if (!warnings.isEmpty()) {
            map.put(PipelineState.WARNINGS, List.copyOf(warnings));
        }
        return Collections.unmodifiableMap(map);
    }

    private StateUpdate put(String key, Object value) {
        values.put(key, Objects.requireNonNull(value, key));
        return this;
    }

    @Override
    public String toString() {
        return "StateUpdate" + toMap().keySet();
    }
}
