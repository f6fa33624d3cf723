package com.blogsmith.dispatch.cli;

import com.blogsmith.config.ConfigurationException;
import com.blogsmith.config.ConfigurationValidator;
import com.blogsmith.core.collab.PublishRequest;
import com.blogsmith.core.collab.PublishSink;
import com.blogsmith.core.model.PublishResult;
import com.blogsmith.publish.MarkdownArchive;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: blogsmith republish &lt;file&gt; [--status draft|published]
 * <p>
 * Re-sends a post saved by the local archive, e.g. after Ghost was unreachable.
 */
@Command(name = "republish", mixinStandardHelpOptions = true,
        description = "Re-send an archived post from the output folder")
@Component
public class RepublishCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Archived Markdown file, e.g. output/blog_post_20250101_120000.md")
    private Path file;

    @Option(names = "--status", defaultValue = "draft",
            description = "Post status: draft, published (default: ${DEFAULT-VALUE})")
    private String status;

    private final PublishSink publishSink;
    private final ConfigurationValidator validator;

    public RepublishCommand(PublishSink publishSink, ConfigurationValidator validator) {
        this.publishSink = publishSink;
        this.validator = validator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals("draft") && !normalized.equals("published")) {
            ConsoleOutput.error("Invalid status: " + status + ". Valid values: draft, published");
            return ExitCodes.CONFIGURATION;
        }
        if (!Files.isRegularFile(file)) {
            ConsoleOutput.error("File not found: " + file);
            return ExitCodes.FAILED;
        }
        try {
            validator.validatePublishing();
        } catch (ConfigurationException e) {
            ConsoleOutput.configurationProblems(e.getProblems());
            return ExitCodes.CONFIGURATION;
        }

        MarkdownArchive.ArchivedPost post;
        try {
            post = MarkdownArchive.read(file);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error("Could not read " + file + ": " + e.getCause().getMessage());
            return ExitCodes.FAILED;
        }
        ConsoleOutput.info("Title: " + post.title());
        ConsoleOutput.info("Tags: " + String.join(", ", post.metadata().tags()));
        ConsoleOutput.info("Publishing as " + normalized + "...");

        try {
            PublishResult result = publishSink.publish(
                    new PublishRequest(post.content(), post.metadata(), "", normalized.equals("draft")));
            ConsoleOutput.success("Post " + result.postId() + " (" + result.status() + ")");
            ConsoleOutput.success(result.url());
            return ExitCodes.PUBLISHED;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Publishing failed: " + e.getMessage());
            return ExitCodes.FAILED;
        }
    }
}
