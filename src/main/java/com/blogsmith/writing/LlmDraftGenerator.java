package com.blogsmith.writing;

import com.blogsmith.core.collab.DraftGenerator;
import com.blogsmith.core.collab.DraftRequest;
import com.blogsmith.core.llm.LlmService;
import com.blogsmith.core.model.QualityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes and rewrites articles with the LLM.
 * <p>
 * An initial draft is written from the research brief; a revision rewrites the rejected
 * draft and is told about every failing quality check.
 */
@Component
public class LlmDraftGenerator implements DraftGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmDraftGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are an expert technical content writer who creates comprehensive, engaging and
            accessible blog posts on complex technology topics.

            Formatting rules:
            - Output Markdown only, no preamble or closing remarks.
            - Start with exactly one H1 title (# Title). Never use a second H1.
            - Use ## for main sections and ### for subsections; never skip a heading level.
            - Every heading must be followed by at least one full paragraph.
            - Cite sources with inline Markdown links: [descriptive link text](URL), spread
              across all sections. Only use URLs from the research sources.
            - Use **bold** for key terms, bullet lists where they help, fenced code blocks for code.
            """;

    private final LlmService llmService;

    public LlmDraftGenerator(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String generate(DraftRequest request) {
        String prompt;
        if (request instanceof DraftRequest.RevisionDraft revision) {
            log.info("Requesting revision {} ({} failing checks)", revision.revisionCount(), revision.feedback().size());
            prompt = revisionPrompt(revision);
        } else {
            log.info("Requesting initial draft for '{}'", request.topic());
            prompt = initialPrompt(request);
        }
        return stripWrappingFence(llmService.textCall(SYSTEM_PROMPT, prompt));
    }

    String initialPrompt(DraftRequest request) {
        var t = request.targets();
        return """
                Write a complete, publication-ready blog post on: %s

                Tone: %s
                %s
                Requirements:
                - At least %d words; write every section in full.
                - An introduction, at least %d main (##) sections, and a conclusion.
                - At least %d inline links to the research sources, distributed through the article.

                Research brief:
                %s

                Sources:
                %s
                """.formatted(request.topic(), request.tone(), instructionsBlock(request.instructions()),
                t.minWordCount(), t.minSections(), t.minInlineLinks(),
                request.research().summary(), sourceList(request.research().sources()));
    }

    String revisionPrompt(DraftRequest.RevisionDraft revision) {
        var t = revision.targets();
        return """
                Revise the blog post below on: %s

                Tone: %s
                %s
                The automated review rejected it (revision %d). Fix EVERY issue listed:
                %s
                Keep what already works. Targets: at least %d words, exactly one H1, at least %d ## sections,
                at least %d inline links, no empty sections.

                Sources you may link:
                %s

                Previous draft:
                %s
                """.formatted(revision.topic(), revision.tone(), instructionsBlock(revision.instructions()),
                revision.revisionCount(), issueList(revision.feedback()),
                t.minWordCount(), t.minSections(), t.minInlineLinks(),
                sourceList(revision.research().sources()), revision.previousDraft());
    }

    private static String instructionsBlock(String instructions) {
        return instructions == null || instructions.isBlank()
                ? ""
                : "Additional instructions: " + instructions + "\n";
    }

    private static String issueList(List<QualityCheck> feedback) {
        var sb = new StringBuilder();
        int n = 1;
        for (QualityCheck check : feedback) {
            sb.append(n++).append(". [").append(check.type()).append("] ").append(check.message()).append('\n');
        }
        return sb.toString();
    }

    private static String sourceList(List<String> sources) {
        if (sources.isEmpty()) {
            return "(none)";
        }
        var sb = new StringBuilder();
        int n = 1;
        for (String url : sources) {
            sb.append('[').append(n++).append("] ").append(url).append('\n');
        }
        return sb.toString();
    }

    /**
     * Models sometimes wrap the whole article in a ```markdown fence.
     */
    static String stripWrappingFence(String text) {
        String trimmed = text.strip();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() > 6) {
            int firstNewline = trimmed.indexOf('\n');
            if (firstNewline > 0) {
                return trimmed.substring(firstNewline + 1, trimmed.length() - 3).strip();
            }
        }
        return trimmed;
    }
}
