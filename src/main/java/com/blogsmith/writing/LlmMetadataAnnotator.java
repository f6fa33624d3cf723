package com.blogsmith.writing;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.collab.MetadataAnnotator;
import com.blogsmith.core.llm.LlmService;
import com.blogsmith.core.model.ArticleMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the LLM for SEO metadata, then clamps the answer to the lengths Ghost and search
 * engines expect. If the LLM call fails, metadata is derived from the content itself.
 */
@Component
public class LlmMetadataAnnotator implements MetadataAnnotator {

    private static final Logger log = LoggerFactory.getLogger(LlmMetadataAnnotator.class);

    static final int MAX_TITLE = 60;
    static final int MAX_DESCRIPTION = 160;
    static final int MAX_EXCERPT = 300;
    static final int FALLBACK_EXCERPT = 250;
    static final int MIN_TAGS = 5;
    static final int MAX_TAGS = 8;

    private static final Pattern H1 = Pattern.compile("(?m)^#\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("!?\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern MARKUP = Pattern.compile("[*_`>#]|^\\s*[-+]\\s+", Pattern.MULTILINE);

    private static final String SYSTEM_PROMPT = """
            You are an SEO specialist for a technology blog. Given an article, produce:
            - title: compelling, at most 60 characters
            - description: meta description, 150-160 characters
            - excerpt: 2-3 sentence summary, at most 300 characters
            - tags: 5-8 short lowercase topic tags
            - keywords: 5-10 search keywords
            """;

    /** Shape the LLM is asked to return. */
    record MetadataDraft(String title, String description, String excerpt,
                         List<String> tags, List<String> keywords) {}

    private final LlmService llmService;
    private final List<String> defaultTags;

    public LlmMetadataAnnotator(LlmService llmService, BlogsmithProperties properties) {
        this.llmService = llmService;
        this.defaultTags = List.copyOf(properties.getPublish().getDefaultTags());
    }

    @Override
    public ArticleMetadata annotate(String content, String instructions) {
        String prompt = "Article:\n\n" + content
                + (instructions == null || instructions.isBlank() ? "" : "\n\nEditorial instructions: " + instructions);
        try {
            MetadataDraft draft = llmService.structuredCall(SYSTEM_PROMPT, prompt, MetadataDraft.class);
            return normalize(draft, content);
        } catch (RuntimeException e) {
            log.warn("Metadata generation failed, deriving metadata from content: {}", e.getMessage());
            return fallback(content);
        }
    }

    ArticleMetadata normalize(MetadataDraft draft, String content) {
        String title = blankToNull(draft.title());
        if (title == null) {
            title = headingOrDefault(content);
        }
        String excerpt = blankToNull(draft.excerpt());
        if (excerpt == null) {
            excerpt = plainText(content);
        }
        String description = blankToNull(draft.description());
        if (description == null) {
            description = excerpt;
        }
        return new ArticleMetadata(
                truncate(title, MAX_TITLE),
                truncate(description, MAX_DESCRIPTION),
                truncate(excerpt, MAX_EXCERPT),
                tags(draft.tags()),
                distinct(draft.keywords()));
    }

    ArticleMetadata fallback(String content) {
        String title = headingOrDefault(content);
        String text = plainText(content);
        return new ArticleMetadata(
                truncate(title, MAX_TITLE),
                truncate(text, MAX_DESCRIPTION),
                truncate(text, FALLBACK_EXCERPT),
                tags(List.of()),
                List.of());
    }

    private List<String> tags(List<String> proposed) {
        Set<String> tags = new LinkedHashSet<>();
        if (proposed != null) {
            for (String tag : proposed) {
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.strip().toLowerCase(Locale.ROOT));
                }
            }
        }
        for (String tag : defaultTags) {
            if (tags.size() >= MIN_TAGS) {
                break;
            }
            tags.add(tag);
        }
        return new ArrayList<>(tags).subList(0, Math.min(tags.size(), MAX_TAGS));
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) {
            return List.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                result.add(v.strip());
            }
        }
        return List.copyOf(result);
    }

    static String headingOrDefault(String content) {
        Matcher m = H1.matcher(content == null ? "" : content);
        return m.find() ? m.group(1) : "Untitled";
    }

    /** First paragraph of body text with Markdown markup removed. */
    static String plainText(String content) {
        if (content == null) {
            return "";
        }
        for (String block : content.split("\\n\\s*\\n")) {
            String trimmed = block.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("```")) {
                continue;
            }
            String text = MARKDOWN_LINK.matcher(trimmed).replaceAll("$1");
            text = MARKUP.matcher(text).replaceAll("");
            return text.replaceAll("\\s+", " ").strip();
        }
        return "";
    }

    /** Cuts at the last word boundary that fits, falling back to a hard cut. */
    static String truncate(String value, int max) {
        String v = value.strip();
        if (v.length() <= max) {
            return v;
        }
        int cut = v.lastIndexOf(' ', max);
        return (cut > max / 2 ? v.substring(0, cut) : v.substring(0, max)).strip();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
