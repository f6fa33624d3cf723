package com.blogsmith.core.state;

import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.model.PublishResult;
import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.ResearchSummary;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Graph state carried through the content pipeline.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every field except
 * {@code errors} and {@code warnings} uses a replacing channel: a stage that writes a field
 * replaces it entirely. {@code errors} and {@code warnings} use appender channels that keep
 * repeated entries, and are never cleared within a run.
 * <p>
 * Instances are treated as values. {@link #merge(PipelineState, StateUpdate)} produces a new
 * state and never touches its input.
 */
public class PipelineState extends AgentState {

    public static final String TOPIC = "topic";
    public static final String TONE = "tone";
    public static final String INSTRUCTIONS = "instructions";
    public static final String RESEARCH = "research";
    public static final String DRAFT_CONTENT = "draftContent";
    public static final String FORMATTED_CONTENT = "formattedContent";
    public static final String METADATA = "metadata";
    public static final String REVISION_COUNT = "revisionCount";
    public static final String APPROVAL_STATUS = "approvalStatus";
    public static final String FEEDBACK = "feedback";
    public static final String QUALITY_CHECKS = "qualityChecks";
    public static final String FORCED_NOTE = "forcedNote";
    public static final String PUBLICATION = "publication";
    public static final String ERRORS = "errors";
    public static final String WARNINGS = "warnings";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Inputs ───────────────────────────────────────────────────
        Map.entry(TOPIC,             Channels.base(() -> "")),
        Map.entry(TONE,              Channels.base(() -> "")),
        Map.entry(INSTRUCTIONS,      Channels.base(() -> "")),

        // ── Stage outputs (replaced on write) ────────────────────────
        Map.entry(RESEARCH,          Channels.base((Reducer<ResearchSummary>) null)),
        Map.entry(DRAFT_CONTENT,     Channels.base(() -> "")),
        Map.entry(FORMATTED_CONTENT, Channels.base(() -> "")),
        Map.entry(METADATA,          Channels.base((Reducer<ArticleMetadata>) null)),
        Map.entry(PUBLICATION,       Channels.base((Reducer<PublishResult>) null)),

        // ── Review loop ──────────────────────────────────────────────
        Map.entry(REVISION_COUNT,    Channels.base(() -> 0)),
        Map.entry(APPROVAL_STATUS,   Channels.base(() -> ApprovalStatus.PENDING.name())),
        Map.entry(FEEDBACK,          Channels.base((Supplier<List<QualityCheck>>) List::of)),
        Map.entry(QUALITY_CHECKS,    Channels.base((Supplier<List<QualityCheck>>) List::of)),
        Map.entry(FORCED_NOTE,       Channels.base(() -> "")),

        // ── Appender channels ────────────────────────────────────────
        Map.entry(ERRORS,            Channels.appenderWithDuplicate(ArrayList::new)),
        Map.entry(WARNINGS,          Channels.appenderWithDuplicate(ArrayList::new))
    );

    private static final Set<String> APPEND_ONLY = Set.of(ERRORS, WARNINGS);

    public PipelineState(Map<String, Object> initData) {
        super(initData);
    }

    /**
     * Creates the entry state of a run: only the topic and the optional overrides are set.
     */
    public static PipelineState initial(String topic, String tone, String instructions) {
        var data = new HashMap<String, Object>();
        data.put(TOPIC, topic);
        if (tone != null && !tone.isBlank()) {
            data.put(TONE, tone);
        }
        if (instructions != null && !instructions.isBlank()) {
            data.put(INSTRUCTIONS, instructions);
        }
        return new PipelineState(data);
    }

    // ── Merge ────────────────────────────────────────────────────────

    /**
     * Merges a typed partial update into {@code state}, returning a new state.
     */
    public static PipelineState merge(PipelineState state, StateUpdate update) {
        return merge(state, update.toMap());
    }

    /**
     * Merges a raw partial update into {@code state}, returning a new state.
     * <p>
     * Absent fields carry over, present fields replace, {@code errors} and {@code warnings}
     * are concatenated.
     *
     * @throws UnknownStateFieldException if {@code partial} names a field outside {@link #SCHEMA}
     */
    public static PipelineState merge(PipelineState state, Map<String, Object> partial) {
        requireKnownFields(partial);
        var merged = new HashMap<String, Object>(state.data());
        for (var entry : partial.entrySet()) {
            String key = entry.getKey();
            if (APPEND_ONLY.contains(key)) {
                var combined = new ArrayList<Object>(asList(merged.get(key)));
                combined.addAll(asList(entry.getValue()));
                merged.put(key, List.copyOf(combined));
            } else {
                merged.put(key, entry.getValue());
            }
        }
        return new PipelineState(merged);
    }

    /**
     * Rejects any key that is not a declared state field.
     *
     * @throws UnknownStateFieldException on the first unknown key
     */
    public static void requireKnownFields(Map<String, Object> partial) {
        for (String key : partial.keySet()) {
            if (!SCHEMA.containsKey(key)) {
                throw new UnknownStateFieldException(key);
            }
        }
    }

    private static List<?> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        return List.of(value);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String topic() {
        return this.<String>value(TOPIC).orElse("");
    }

    public String tone() {
        return this.<String>value(TONE).orElse("");
    }

    public String instructions() {
        return this.<String>value(INSTRUCTIONS).orElse("");
    }

    public Optional<ResearchSummary> research() {
        return value(RESEARCH);
    }

    public String draftContent() {
        return this.<String>value(DRAFT_CONTENT).orElse("");
    }

    public String formattedContent() {
        return this.<String>value(FORMATTED_CONTENT).orElse("");
    }

    /**
     * The content the gate and the publish stage look at: formatted output when present,
     * otherwise the raw draft.
     */
    public String finalContent() {
        String formatted = formattedContent();
        return formatted.isBlank() ? draftContent() : formatted;
    }

    public Optional<ArticleMetadata> metadata() {
        return value(METADATA);
    }

    public int revisionCount() {
        return this.<Integer>value(REVISION_COUNT).orElse(0);
    }

    public ApprovalStatus approvalStatus() {
        String raw = this.<String>value(APPROVAL_STATUS).orElse(ApprovalStatus.PENDING.name());
        return ApprovalStatus.valueOf(raw);
    }

    public String forcedNote() {
        return this.<String>value(FORCED_NOTE).orElse("");
    }

    public Optional<PublishResult> publication() {
        return value(PUBLICATION);
    }

    // ── List accessors ───────────────────────────────────────────────

    public List<QualityCheck> feedback() {
        return checks(FEEDBACK);
    }

    public List<QualityCheck> qualityChecks() {
        return checks(QUALITY_CHECKS);
    }

    public List<String> errors() {
        return strings(ERRORS);
    }

    public List<String> warnings() {
        return strings(WARNINGS);
    }

    private List<QualityCheck> checks(String key) {
        List<?> raw = this.<List<?>>value(key).orElse(List.of());
        return raw.stream()
                .filter(QualityCheck.class::isInstance)
                .map(QualityCheck.class::cast)
                .toList();
    }

    private List<String> strings(String key) {
        List<?> raw = this.<List<?>>value(key).orElse(List.of());
        return raw.stream().map(String::valueOf).toList();
    }
}
