package com.blogsmith.core.gate;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@link ContentMetrics} from Markdown content.
 * <p>
 * Headings and links inside fenced code blocks are ignored. Analysis is purely textual
 * and deterministic: the same input always yields the same metrics.
 */
@Component
public class ContentAnalyzer {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern FENCE = Pattern.compile("^\\s*(```|~~~)");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("(?<!!)\\[([^\\]]+)]\\(([^)\\s]+)[^)]*\\)");
    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern HTML_ANCHOR = Pattern.compile("<a\\s[^>]*href\\s*=\\s*[\"'][^\"']+[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WORDLIKE = Pattern.compile("[\\p{L}\\p{N}]");

    public ContentMetrics analyze(String content) {
        String text = content == null ? "" : content;
        List<Line> lines = classify(text);

        int h1 = 0;
        int h2 = 0;
        int links = 0;
        for (Line line : lines) {
            if (line.headingLevel() == 1) h1++;
            if (line.headingLevel() == 2) h2++;
            if (!line.fenced()) {
                links += countLinks(line.text());
            }
        }
        return new ContentMetrics(countWords(text), links, h1, h2, structuralIssues(lines));
    }

    int countWords(String content) {
        String text = HTML_TAG.matcher(content).replaceAll(" ");
        text = MARKDOWN_IMAGE.matcher(text).replaceAll("$1");
        text = MARKDOWN_LINK.matcher(text).replaceAll("$1");
        int count = 0;
        for (String token : text.split("\\s+")) {
            // Bare markup tokens such as "#", "-", "---" or "|" are not words
            if (!token.isEmpty() && WORDLIKE.matcher(token).find()) {
                count++;
            }
        }
        return count;
    }

    private int countLinks(String line) {
        int count = 0;
        Matcher md = MARKDOWN_LINK.matcher(line);
        while (md.find()) {
            count++;
        }
        Matcher html = HTML_ANCHOR.matcher(line);
        while (html.find()) {
            count++;
        }
        return count;
    }

    /**
     * A heading's section runs until the next heading of the same or a higher level. The
     * section is empty when it holds no body text, counting text under nested subheadings.
     */
    private List<String> structuralIssues(List<Line> lines) {
        var issues = new ArrayList<String>();
        if (lines.stream().allMatch(l -> l.text().isBlank())) {
            issues.add("Document is empty");
            return issues;
        }

        int previousLevel = 0;
        for (int i = 0; i < lines.size(); i++) {
            Line heading = lines.get(i);
            if (heading.headingLevel() == 0) {
                continue;
            }
            if (previousLevel > 0 && heading.headingLevel() > previousLevel + 1) {
                issues.add("Heading '%s' skips from H%d to H%d"
                        .formatted(heading.headingText(), previousLevel, heading.headingLevel()));
            }
            previousLevel = heading.headingLevel();

            boolean hasBody = false;
            for (int j = i + 1; j < lines.size(); j++) {
                Line next = lines.get(j);
                if (next.headingLevel() > 0 && next.headingLevel() <= heading.headingLevel()) {
                    break;
                }
                if (next.headingLevel() == 0 && !next.text().isBlank()) {
                    hasBody = true;
                }
            }
            if (!hasBody) {
                issues.add(isLastHeading(lines, i)
                        ? "Heading '%s' at the end of the document has no content".formatted(heading.headingText())
                        : "Section '%s' is empty".formatted(heading.headingText()));
            }
        }
        return issues;
    }

    private boolean isLastHeading(List<Line> lines, int index) {
        for (int j = index + 1; j < lines.size(); j++) {
            if (lines.get(j).headingLevel() > 0) {
                return false;
            }
        }
        return true;
    }

    private List<Line> classify(String content) {
        var result = new ArrayList<Line>();
        boolean inFence = false;
        for (String raw : content.split("\\R", -1)) {
            if (FENCE.matcher(raw).find()) {
                inFence = !inFence;
                result.add(new Line(raw, true, 0, ""));
                continue;
            }
            if (!inFence) {
                Matcher m = HEADING.matcher(raw);
                if (m.matches()) {
                    result.add(new Line(raw, false, m.group(1).length(), m.group(2)));
                    continue;
                }
            }
            result.add(new Line(raw, inFence, 0, ""));
        }
        return result;
    }

    private record Line(String text, boolean fenced, int headingLevel, String headingText) {}
}
