package com.blogsmith.writing;

import com.blogsmith.core.collab.ContentFormatter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic Markdown cleanup applied to every draft.
 * <ul>
 *   <li>ATX headings get a space after the hashes</li>
 *   <li>only the first H1 stays an H1; later ones become H2</li>
 *   <li>{@code *} and {@code +} bullets become {@code -}</li>
 *   <li>headings are surrounded by blank lines</li>
 *   <li>trailing whitespace is removed and runs of blank lines collapse to one</li>
 * </ul>
 * Fenced code blocks are left untouched.
 */
@Component
public class MarkdownContentFormatter implements ContentFormatter {

    private static final Pattern FENCE = Pattern.compile("^\\s*(```|~~~)");
    private static final Pattern TIGHT_HEADING = Pattern.compile("^(#{1,6})([^\\s#].*)$");
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*)$");
    private static final Pattern BULLET = Pattern.compile("^(\\s*)[*+]\\s+(?=\\S)");

    @Override
    public String format(String draft) {
        if (draft == null || draft.isBlank()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        boolean inFence = false;
        boolean h1Seen = false;

        for (String raw : draft.split("\\R", -1)) {
            String line = stripTrailing(raw);
            if (FENCE.matcher(line).find()) {
                inFence = !inFence;
                lines.add(line);
                continue;
            }
            if (inFence) {
                lines.add(line);
                continue;
            }

            Matcher tight = TIGHT_HEADING.matcher(line);
            if (tight.matches()) {
                line = tight.group(1) + " " + tight.group(2);
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                int level = heading.group(1).length();
                if (level == 1) {
                    if (h1Seen) {
                        line = "## " + heading.group(2);
                    }
                    h1Seen = true;
                }
                addBlankIfNeeded(lines);
                lines.add(line);
                lines.add("");
                continue;
            }

            line = BULLET.matcher(line).replaceFirst("$1- ");
            lines.add(line);
        }
        return collapseBlankLines(lines);
    }

    private static void addBlankIfNeeded(List<String> lines) {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
    }

    private static String collapseBlankLines(List<String> lines) {
        var sb = new StringBuilder();
        boolean previousBlank = true;
        for (String line : lines) {
            boolean blank = line.isEmpty();
            if (blank && previousBlank) {
                continue;
            }
            sb.append(line).append('\n');
            previousBlank = blank;
        }
        String result = sb.toString().strip();
        return result.isEmpty() ? "" : result + "\n";
    }

    private static String stripTrailing(String line) {
        return line.stripTrailing();
    }
}
