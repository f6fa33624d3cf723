package com.blogsmith.publish;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.core.collab.ContentArchive;
import com.blogsmith.core.collab.PublishRequest;
import com.blogsmith.core.model.ArticleMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes each post to {@code <output-dir>/blog_post_<yyyyMMdd_HHmmss>.md}.
 * <p>
 * File layout:
 * <pre>
 * # Title
 *
 * **Meta Description:** ...
 *
 * **Tags:** tag1, tag2
 *
 * ---
 *
 * (content, including any disclosure note)
 * </pre>
 * {@link #read(Path)} parses this layout back for republishing.
 */
@Component
@ConditionalOnProperty(prefix = "blogsmith.publish", name = "archive-enabled", havingValue = "true", matchIfMissing = true)
public class MarkdownArchive implements ContentArchive {

    private static final Logger log = LoggerFactory.getLogger(MarkdownArchive.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String SEPARATOR = "---";
    private static final int EXCERPT_LENGTH = 250;

    private static final Pattern TITLE = Pattern.compile("(?m)^#\\s+(.+)$");
    private static final Pattern META_DESCRIPTION = Pattern.compile("\\*\\*Meta Description:\\*\\*[ \\t]*(.*)");
    private static final Pattern TAGS = Pattern.compile("\\*\\*Tags:\\*\\*[ \\t]*(.*)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)]\\([^)]+\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*([^*]+)\\*");

    /** A post recovered from an archive file. */
    public record ArchivedPost(String title, String content, ArticleMetadata metadata) {}

    private final Path outputDir;
    private final Clock clock;

    @Autowired
    public MarkdownArchive(BlogsmithProperties properties) {
        this(Path.of(properties.getPublish().getOutputDir()), Clock.systemDefaultZone());
    }

    MarkdownArchive(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    @Override
    public Path save(PublishRequest request) {
        ArticleMetadata metadata = request.metadata();
        Path file = outputDir.resolve("blog_post_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".md");
        var sb = new StringBuilder()
                .append("# ").append(metadata.title()).append("\n\n")
                .append("**Meta Description:** ").append(metadata.description()).append("\n\n")
                .append("**Tags:** ").append(String.join(", ", metadata.tags())).append("\n\n")
                .append(SEPARATOR).append("\n\n")
                .append(request.contentWithNote());
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + file, e);
        }
        log.debug("Wrote {} chars to {}", sb.length(), file);
        return file;
    }

    /**
     * Parses an archive file. A file without the header is read as plain Markdown: the first
     * H1 becomes the title and there is no description or tags.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public static ArchivedPost read(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
        String normalized = text.replace("\r\n", "\n");

        String header = "";
        String content = normalized;
        int sep = indexOfSeparatorLine(normalized);
        if (sep >= 0) {
            header = normalized.substring(0, sep);
            content = normalized.substring(sep + SEPARATOR.length()).strip();
        }

        Matcher title = TITLE.matcher(header.isEmpty() ? content : header);
        String postTitle = title.find() ? title.group(1).strip() : "Untitled Post";
        String description = firstGroup(META_DESCRIPTION, header);
        List<String> tags = new ArrayList<>();
        for (String tag : firstGroup(TAGS, header).split(",")) {
            if (!tag.isBlank()) {
                tags.add(tag.strip());
            }
        }
        var metadata = new ArticleMetadata(postTitle, description, excerpt(content), tags, List.of());
        return new ArchivedPost(postTitle, content, metadata);
    }

    private static int indexOfSeparatorLine(String text) {
        Matcher m = Pattern.compile("(?m)^---[ \\t]*$").matcher(text);
        return m.find() ? m.start() : -1;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).strip() : "";
    }

    static String excerpt(String content) {
        for (String paragraph : content.split("\n\n")) {
            String p = paragraph.strip();
            if (p.isEmpty() || p.startsWith("#")) {
                continue;
            }
            p = LINK.matcher(p).replaceAll("$1");
            p = BOLD.matcher(p).replaceAll("$1");
            p = ITALIC.matcher(p).replaceAll("$1");
            return p.length() > EXCERPT_LENGTH ? p.substring(0, EXCERPT_LENGTH) + "..." : p;
        }
        return "";
    }
}
