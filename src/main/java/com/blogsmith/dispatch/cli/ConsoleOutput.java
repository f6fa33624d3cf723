package com.blogsmith.dispatch.cli;

import com.blogsmith.core.engine.PipelineResult;
import com.blogsmith.core.events.PipelineEvent;
import com.blogsmith.core.gate.ContentMetrics;
import com.blogsmith.core.model.ApprovalStatus;
import com.blogsmith.core.model.RunOutcome;
import com.blogsmith.core.state.PipelineState;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for Blogsmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) BLOGSMITH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [BLOGSMITH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void configurationProblems(List<String> problems) {
        error("Configuration is incomplete (" + problems.size() + " problem" + (problems.size() != 1 ? "s" : "") + "):");
        for (String problem : problems) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + problem));
        }
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "stage.completed" -> "@|fg(blue) [STAGE]|@";
            case "gate.approved" -> "@|fg(green),bold [GATE]|@";
            case "gate.rejected" -> "@|fg(yellow),bold [GATE]|@";
            case "gate.force_published" -> "@|fg(magenta),bold [GATE]|@";
            case "run.published" -> "@|fg(green),bold [PUBLISHED]|@";
            case "run.failed" -> "@|fg(red),bold [FAILED]|@";
            case "run.cancelled" -> "@|fg(red),bold [CANCELLED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String stage = event.stage() == null ? "" : event.stage() + " ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + stage + event.payload()));
    }

    public static void summary(PipelineResult result, ContentMetrics metrics) {
        PipelineState state = result.state();
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + result.runId() + "|@"));

        state.metadata().ifPresent(m -> {
            System.out.println("  Title:     " + m.title());
            System.out.println("  Tags:      " + String.join(", ", m.tags()));
        });
        System.out.println("  Words:     " + metrics.wordCount());
        System.out.println("  Links:     " + metrics.inlineLinks());
        System.out.println("  Sections:  " + metrics.h2Count());
        System.out.println("  Revisions: " + state.revisionCount());
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Review:    " + approval(state.approvalStatus())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  Outcome:   " + outcome(result.outcome())));
        state.publication().ifPresent(p -> {
            System.out.println("  Status:    " + p.status());
            System.out.println("  URL:       " + p.url());
        });
        System.out.println("  Duration:  " + formatDuration(result.elapsed().toMillis()));

        if (!state.warnings().isEmpty()) {
            System.out.println();
            warning("Warnings (" + state.warnings().size() + "):");
            state.warnings().forEach(w -> warning("  " + w));
        }
        if (!state.errors().isEmpty()) {
            System.out.println();
            error("Errors (" + state.errors().size() + "):");
            state.errors().forEach(e -> error("  " + e));
        }
    }

    private static String approval(ApprovalStatus status) {
        return switch (status) {
            case APPROVED -> "@|fg(green) approved|@";
            case FORCE_PUBLISHED -> "@|fg(magenta) force-published (revision limit reached)|@";
            case REJECTED -> "@|fg(yellow) rejected|@";
            case PENDING -> "pending";
        };
    }

    private static String outcome(RunOutcome outcome) {
        return switch (outcome) {
            case PUBLISHED -> "@|fg(green),bold PUBLISHED|@";
            case FAILED -> "@|fg(red),bold FAILED|@";
            case CANCELLED -> "@|fg(red),bold CANCELLED|@";
        };
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
