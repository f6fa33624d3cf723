package com.blogsmith.core.gate;

import com.blogsmith.core.model.QualityCheck;
import com.blogsmith.core.model.QualityCheckType;
import com.blogsmith.core.revision.RevisionBoundViolation;
import com.blogsmith.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether content is approved, sent back for revision, or force-published.
 * <p>
 * The decision is a pure function of the content metrics, the thresholds, the current
 * revision count and the revision bound. Every check is evaluated on every call so that a
 * rejection enumerates all gaps at once.
 * <ul>
 *   <li>All checks pass: {@link GateDecision.Approved}</li>
 *   <li>Some check fails and {@code revisionCount < maxRevisions}: {@link GateDecision.Rejected}</li>
 *   <li>Some check fails and {@code revisionCount == maxRevisions}: {@link GateDecision.ForcePublished}</li>
 * </ul>
 */
@Service
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final ContentAnalyzer analyzer;

    public QualityGate(ContentAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Evaluates the content of {@code state} (formatted content, falling back to the draft).
     */
    public GateDecision evaluate(PipelineState state, GateThresholds thresholds, int maxRevisions) {
        ContentMetrics metrics = analyzer.analyze(state.finalContent());
        log.debug("Content metrics: {}", metrics);
        return decide(metrics, thresholds, state.revisionCount(), maxRevisions);
    }

    public GateDecision decide(ContentMetrics metrics, GateThresholds thresholds,
                               int revisionCount, int maxRevisions) {
        if (revisionCount < 0) {
            throw new IllegalArgumentException("revisionCount must not be negative: " + revisionCount);
        }
        if (revisionCount > maxRevisions) {
            throw new RevisionBoundViolation(
                    "Revision count %d exceeds the maximum of %d".formatted(revisionCount, maxRevisions));
        }

        List<QualityCheck> checks = runChecks(metrics, thresholds);
        List<QualityCheck> failing = checks.stream().filter(c -> !c.passed()).toList();

        if (failing.isEmpty()) {
            log.info("Quality gate APPROVED at revision {} ({} words, {} links, {} sections)",
                    revisionCount, metrics.wordCount(), metrics.inlineLinks(), metrics.h2Count());
            return new GateDecision.Approved(checks);
        }
        if (revisionCount < maxRevisions) {
            log.info("Quality gate REJECTED at revision {}/{}: {} failing check(s) {}",
                    revisionCount, maxRevisions, failing.size(), failingTypes(failing));
            return new GateDecision.Rejected(checks, failing);
        }
        log.warn("Quality gate FORCE_PUBLISHED after {} revision(s): {} check(s) still failing {}",
                revisionCount, failing.size(), failingTypes(failing));
        return new GateDecision.ForcePublished(checks, failing, disclosureNote(failing, maxRevisions));
    }

    List<QualityCheck> runChecks(ContentMetrics m, GateThresholds t) {
        var checks = new ArrayList<QualityCheck>(5);

        int words = m.wordCount();
        checks.add(words >= t.minWordCount()
                ? pass(QualityCheckType.WORD_COUNT, words, t.minWordCount(),
                        "Word count %d meets the minimum of %d".formatted(words, t.minWordCount()))
                : fail(QualityCheckType.WORD_COUNT, words, t.minWordCount(),
                        "Word count is %d; expand the article to at least %d words (%d more)"
                                .formatted(words, t.minWordCount(), t.minWordCount() - words)));

        int links = m.inlineLinks();
        checks.add(links >= t.minInlineLinks()
                ? pass(QualityCheckType.INLINE_LINKS, links, t.minInlineLinks(),
                        "%d inline links meet the minimum of %d".formatted(links, t.minInlineLinks()))
                : fail(QualityCheckType.INLINE_LINKS, links, t.minInlineLinks(),
                        "Only %d inline links; cite at least %d sources inline (%d more)"
                                .formatted(links, t.minInlineLinks(), t.minInlineLinks() - links)));

        int h1 = m.h1Count();
        checks.add(h1 == 1
                ? pass(QualityCheckType.SINGLE_H1, h1, 1, "Exactly one top-level title")
                : fail(QualityCheckType.SINGLE_H1, h1, 1,
                        "Found %d top-level (H1) headings; use exactly one H1 for the title".formatted(h1)));

        int h2 = m.h2Count();
        checks.add(h2 >= t.minSections()
                ? pass(QualityCheckType.SECTIONS, h2, t.minSections(),
                        "%d sections meet the minimum of %d".formatted(h2, t.minSections()))
                : fail(QualityCheckType.SECTIONS, h2, t.minSections(),
                        "Only %d second-level (H2) sections; add at least %d more to reach %d"
                                .formatted(h2, t.minSections() - h2, t.minSections())));

        List<String> issues = m.structuralIssues();
        checks.add(issues.isEmpty()
                ? pass(QualityCheckType.STRUCTURE, 0, 0, "Document structure is well-formed")
                : fail(QualityCheckType.STRUCTURE, issues.size(), 0,
                        "Fix %d structural issue(s): %s".formatted(issues.size(), String.join("; ", issues))));

        return List.copyOf(checks);
    }

    static String disclosureNote(List<QualityCheck> failing, int maxRevisions) {
        var note = new StringBuilder()
                .append("**Editor's Note (Publication Override):**\n")
                .append("This article was published after reaching the maximum revision limit (")
                .append(maxRevisions).append(maxRevisions == 1 ? " revision" : " revisions").append(").\n")
                .append("The automated quality review still reported the following issues:\n\n");
        for (QualityCheck check : failing) {
            note.append("- ").append(check.message()).append('\n');
        }
        note.append("\nPlease review and consider further editing in a follow-up post.\n\n---\n\n");
        return note.toString();
    }

    private static List<QualityCheckType> failingTypes(List<QualityCheck> failing) {
        return failing.stream().map(QualityCheck::type).toList();
    }

    private static QualityCheck pass(QualityCheckType type, int measured, int threshold, String message) {
        return new QualityCheck(type, true, measured, threshold, message);
    }

    private static QualityCheck fail(QualityCheckType type, int measured, int threshold, String message) {
        return new QualityCheck(type, false, measured, threshold, message);
    }
}
