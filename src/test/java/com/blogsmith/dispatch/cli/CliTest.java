package com.blogsmith.dispatch.cli;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.config.ConfigurationException;
import com.blogsmith.config.ConfigurationValidator;
import com.blogsmith.config.PipelineConfig;
import com.blogsmith.core.collab.PublishRequest;
import com.blogsmith.core.collab.PublishSink;
import com.blogsmith.core.engine.PipelineEngine;
import com.blogsmith.core.engine.PipelineResult;
import com.blogsmith.core.events.EventBus;
import com.blogsmith.core.gate.ContentAnalyzer;
import com.blogsmith.core.graph.TopologyRenderer;
import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.ArticleMetadata;
import com.blogsmith.core.model.PublishResult;
import com.blogsmith.core.model.RunOutcome;
import com.blogsmith.core.state.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private PipelineEngine engine;
    private ConfigurationValidator validator;
    private PublishSink publishSink;
    private BlogsmithProperties properties;

    @BeforeEach
    void setUp() {
        engine = mock(PipelineEngine.class);
        validator = mock(ConfigurationValidator.class);
        publishSink = mock(PublishSink.class);
        properties = new BlogsmithProperties();
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RepublishCommand.class) {
                    return (K) new RepublishCommand(publishSink, validator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var command = new BlogsmithCommand(engine, properties, validator, new TopologyRenderer(),
                    new ContentAnalyzer(), new EventBus());
            int exitCode = new CommandLine(command, factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static PipelineResult result(RunOutcome outcome) {
        var state = PipelineState.merge(PipelineState.initial("Rust ownership", null, null), Map.of(
                PipelineState.FORMATTED_CONTENT, "# Rust Ownership\n\nBody with a [link](https://a.test).\n",
                PipelineState.APPROVAL_STATUS, ApprovalStatus.APPROVED.name(),
                PipelineState.METADATA, new ArticleMetadata("Rust Ownership", "d", "e", List.of("rust"), List.of()),
                PipelineState.PUBLICATION, new PublishResult("p1", "https://blog.example.com/rust/", "draft")));
        return new PipelineResult("run-1", state, outcome, Duration.ofSeconds(42));
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the subcommands")
        void help() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("republish"));
            assertTrue(result.output().contains("--word-count"));
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Blogsmith 0.1.0"));
        }
    }

    @Nested
    @DisplayName("Visualize")
    class VisualizeTests {

        @Test
        @DisplayName("prints a mermaid flowchart without running the pipeline")
        void mermaid() {
            CliResult result = execute("--visualize");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("flowchart TD"));
            verify(engine, never()).run(anyString(), any(PipelineConfig.class));
        }

        @Test
        @DisplayName("prints the text format")
        void text() {
            CliResult result = execute("--visualize", "--format", "text");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Pipeline topology (max revisions: 3)"));
        }

        @Test
        @DisplayName("an unknown format is a usage error")
        void unknownFormat() {
            CliResult result = execute("--visualize", "--format", "svg");

            assertEquals(CommandLine.ExitCode.USAGE, result.exitCode());
            assertTrue(result.output().contains("Unknown format"));
        }
    }

    @Nested
    @DisplayName("Run")
    class RunTests {

        @Test
        @DisplayName("a missing topic prints usage")
        void missingTopic() {
            CliResult result = execute();

            assertEquals(CommandLine.ExitCode.USAGE, result.exitCode());
            assertTrue(result.output().contains("A topic is required"));
        }

        @Test
        @DisplayName("invalid configuration exits before running")
        void configurationError() {
            doThrow(new ConfigurationException(List.of("blogsmith.search.brave-api-key is not set (BRAVE_API_KEY)")))
                    .when(validator).validate(any());

            CliResult result = execute("Rust ownership");

            assertEquals(ExitCodes.CONFIGURATION, result.exitCode());
            assertTrue(result.output().contains("BRAVE_API_KEY"));
            verify(engine, never()).run(anyString(), any(PipelineConfig.class));
        }

        @Test
        @DisplayName("a published run exits 0 and shows the summary")
        void published() {
            when(engine.run(anyString(), any(PipelineConfig.class))).thenReturn(result(RunOutcome.PUBLISHED));

            CliResult result = execute("Rust ownership");

            assertEquals(ExitCodes.PUBLISHED, result.exitCode());
            assertTrue(result.output().contains("https://blog.example.com/rust/"));
            assertTrue(result.output().contains("Rust Ownership"));
        }

        @Test
        @DisplayName("a failed run exits 1")
        void failed() {
            when(engine.run(anyString(), any(PipelineConfig.class))).thenReturn(result(RunOutcome.FAILED));

            assertEquals(ExitCodes.FAILED, execute("Rust ownership").exitCode());
        }

        @Test
        @DisplayName("command-line overrides reach the run configuration")
        void overrides() {
            when(engine.run(anyString(), any(PipelineConfig.class))).thenReturn(result(RunOutcome.PUBLISHED));

            execute("Rust ownership", "--tone", "playful", "--word-count", "1200", "-i", "Mention lifetimes");

            var config = ArgumentCaptor.forClass(PipelineConfig.class);
            verify(engine).run(eq("Rust ownership"), config.capture());
            assertEquals("playful", config.getValue().tone());
            assertEquals("Mention lifetimes", config.getValue().instructions());
            assertEquals(1200, config.getValue().thresholds().minWordCount());
        }
    }

    @Nested
    @DisplayName("Republish")
    class RepublishTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("re-sends an archived post")
        void republishes() throws Exception {
            Path file = dir.resolve("post.md");
            Files.writeString(file, "# Saved Post\n\n**Meta Description:** desc\n\n**Tags:** a, b\n\n---\n\n# Saved Post\n\nBody.\n");
            when(publishSink.publish(any())).thenReturn(new PublishResult("p9", "https://blog.example.com/saved/", "published"));

            CliResult result = execute("republish", file.toString(), "--status", "published");

            assertEquals(0, result.exitCode());
            var request = ArgumentCaptor.forClass(PublishRequest.class);
            verify(publishSink).publish(request.capture());
            assertFalse(request.getValue().draft());
            assertEquals("Saved Post", request.getValue().metadata().title());
            assertEquals(List.of("a", "b"), request.getValue().metadata().tags());
        }

        @Test
        @DisplayName("an invalid status is a configuration error")
        void invalidStatus() throws Exception {
            Path file = dir.resolve("post.md");
            Files.writeString(file, "# Post\n\nBody.\n");

            assertEquals(ExitCodes.CONFIGURATION, execute("republish", file.toString(), "--status", "live").exitCode());
        }

        @Test
        @DisplayName("a missing file fails")
        void missingFile() {
            assertEquals(ExitCodes.FAILED, execute("republish", dir.resolve("nope.md").toString()).exitCode());
            verify(publishSink, never()).publish(any());
        }

        @Test
        @DisplayName("a publishing failure exits 1")
        void publishFails() throws Exception {
            Path file = dir.resolve("post.md");
            Files.writeString(file, "# Post\n\nBody.\n");
            when(publishSink.publish(any())).thenThrow(new RuntimeException("HTTP 502"));

            CliResult result = execute("republish", file.toString());

            assertEquals(ExitCodes.FAILED, result.exitCode());
            assertTrue(result.output().contains("HTTP 502"));
        }
    }
}
