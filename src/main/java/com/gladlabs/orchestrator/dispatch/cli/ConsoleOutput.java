package com.gladlabs.orchestrator.dispatch.cli;

import com.gladlabs.orchestrator.core.model.PhaseResult;
import com.gladlabs.orchestrator.core.model.TaskError;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GLAD ORCHESTRATOR v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ORCHESTRATOR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void phaseResult(PhaseResult result) {
        String status = switch (result.status()) {
            case SUCCEEDED -> "@|fg(green) SUCCEEDED|@";
            case SKIPPED -> "@|fg(yellow) SKIPPED  |@";
            case FAILED -> "@|fg(red) FAILED   |@";
        };
        String score = result.qualityScore() == null ? "" : String.format(Locale.ROOT, " score=%.2f", result.qualityScore());
        String provider = result.providerId() == null ? "" : " via " + result.providerId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + result.phaseName() + " (" + result.attempts() + " attempt"
                        + (result.attempts() != 1 ? "s" : "") + ", " + formatDuration(result.durationMs()) + ")"
                        + score + provider));
        if (result.error() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + describe(result.error())));
        }
    }

    public static String describe(TaskError error) {
        return error.kind().label() + ": " + error.message();
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
