package com.blogsmith.dispatch.cli;

import com.blogsmith.config.BlogsmithProperties;
import com.blogsmith.config.ConfigurationException;
import com.blogsmith.config.ConfigurationValidator;
import com.blogsmith.config.PipelineConfig;
import com.blogsmith.config.RunOptions;
import com.blogsmith.core.engine.PipelineEngine;
import com.blogsmith.core.engine.PipelineResult;
import com.blogsmith.core.events.EventBus;
import com.blogsmith.core.gate.ContentAnalyzer;
import com.blogsmith.core.graph.TopologyRenderer;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top-level CLI command: {@code blogsmith "<topic>"} researches, writes, reviews and publishes
 * one post. {@code --visualize} prints the pipeline topology instead of running it.
 */
@Command(
        name = "blogsmith",
        mixinStandardHelpOptions = true,
        version = "Blogsmith 0.1.0",
        description = "Researches, writes, reviews and publishes a blog post",
        subcommands = {
                RepublishCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class BlogsmithCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Topic of the article")
    private String topic;

    @Option(names = "--tone", description = "Writing tone (default: configured tone)")
    private String tone;

    @Option(names = {"-i", "--instructions"}, description = "Additional instructions for the writer")
    private String instructions;

    @Option(names = "--word-count", description = "Minimum word count for this run")
    private Integer wordCount;

    @Option(names = "--debug", description = "Verbose logging and live pipeline events")
    private boolean debug;

    @Option(names = "--visualize", description = "Print the pipeline topology and exit")
    private boolean visualize;

    @Option(names = "--format", defaultValue = "mermaid",
            description = "Topology format for --visualize: mermaid, text (default: ${DEFAULT-VALUE})")
    private String format;

    @Spec
    private CommandLine.Model.CommandSpec spec;

    private final PipelineEngine engine;
    private final BlogsmithProperties properties;
    private final ConfigurationValidator validator;
    private final TopologyRenderer renderer;
    private final ContentAnalyzer analyzer;
    private final EventBus eventBus;

    public BlogsmithCommand(PipelineEngine engine, BlogsmithProperties properties,
                            ConfigurationValidator validator, TopologyRenderer renderer,
                            ContentAnalyzer analyzer, EventBus eventBus) {
        this.engine = engine;
        this.properties = properties;
        this.validator = validator;
        this.renderer = renderer;
        this.analyzer = analyzer;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        if (visualize) {
            return visualize();
        }

        ConsoleOutput.printBanner();
        if (topic == null || topic.isBlank()) {
            ConsoleOutput.error("A topic is required, e.g. blogsmith \"Kubernetes operators\"");
            spec.commandLine().usage(System.out);
            return CommandLine.ExitCode.USAGE;
        }

        PipelineConfig config = PipelineConfig.from(properties, new RunOptions(tone, instructions, wordCount));
        try {
            validator.validate(config);
        } catch (ConfigurationException e) {
            ConsoleOutput.configurationProblems(e.getProblems());
            return ExitCodes.CONFIGURATION;
        }

        EventBus.Subscription subscription = null;
        if (debug) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel("com.blogsmith", LogLevel.DEBUG);
            subscription = eventBus.subscribeAll(ConsoleOutput::event);
        }

        ConsoleOutput.info("Topic: " + topic);
        ConsoleOutput.info("Targets: %d words, %d links, %d sections, up to %d revision(s)".formatted(
                config.thresholds().minWordCount(), config.thresholds().minInlineLinks(),
                config.thresholds().minSections(), config.maxRevisions()));

        PipelineResult result;
        try {
            result = engine.run(topic, config);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.summary(result, analyzer.analyze(result.state().finalContent()));
        return result.published() ? ExitCodes.PUBLISHED : ExitCodes.FAILED;
    }

    private int visualize() {
        TopologyRenderer.Format parsed;
        try {
            parsed = TopologyRenderer.Format.parse(format);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Unknown format '" + format + "'. Valid formats: mermaid, text");
            return CommandLine.ExitCode.USAGE;
        }
        System.out.print(renderer.render(parsed, properties.getGate().getMaxRevisions()));
        return ExitCodes.PUBLISHED;
    }
}
