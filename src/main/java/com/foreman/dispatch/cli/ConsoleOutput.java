package com.foreman.dispatch.cli;

import com.foreman.core.model.SessionState;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.service.ProgressStats;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Foreman CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FOREMAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FOREMAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(SessionState state) {
        System.out.println("Phase:        " + state.getPhase());
        System.out.println("Current task: " + (state.getCurrentTask() != null ? state.getCurrentTask() : "-"));
        System.out.println("Started:      " + state.getStartedAt());
        System.out.println("Updated:      " + state.getUpdatedAt());
        if (!state.getErrors().isEmpty()) {
            System.out.println("Errors:       " + state.getErrors().size());
        }
        if (!state.getNextAllowedPhases().isEmpty()) {
            System.out.println("Next phases:  " + state.getNextAllowedPhases());
        }
    }

    public static void taskRow(Task task) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-24s %s %-4s %-12s %s",
                task.getId(), colored(task.getStatus()), "P" + task.getPriority(), task.getModule(),
                truncate(task.getDescription(), 40))));
    }

    public static void taskDetail(Task task) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + task.getId() + "|@ " + colored(task.getStatus())));
        System.out.println("  Module:       " + task.getModule());
        System.out.println("  Priority:     " + task.getPriority());
        System.out.println("  Description:  " + task.getDescription());
        if (task.getEstimatedMinutes() != null) {
            System.out.println("  Estimate:     " + task.getEstimatedMinutes() + "m");
        }
        task.getActualDuration().ifPresent(minutes ->
                System.out.println("  Actual:       " + minutes + "m" + (task.isOverEstimate() ? " (over estimate)" : "")));
        if (task.hasDependencies()) {
            System.out.println("  Depends on:   " + String.join(", ", task.getDependencies()));
        }
        for (String criterion : task.getAcceptanceCriteria()) {
            System.out.println("    - " + criterion);
        }
        if (task.getNotes() != null && !task.getNotes().isBlank()) {
            System.out.println("  Notes:");
            task.getNotes().lines().forEach(line -> System.out.println("    " + line));
        }
    }

    public static void progress(String label, ProgressStats stats) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-14s %3d%%  %d total, @|fg(green) %d done|@, %d in progress, %d pending, @|fg(red) %d failed|@, %d blocked",
                label, stats.completionPercentage(), stats.total(), stats.completed(), stats.inProgress(),
                stats.pending(), stats.failed(), stats.blocked())));
    }

    private static String colored(TaskStatus status) {
        String color = switch (status) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case IN_PROGRESS -> "fg(cyan)";
            case BLOCKED -> "fg(yellow)";
            case PENDING -> "fg(white)";
        };
        return "@|" + color + " " + String.format("%-11s", status.value()) + "|@";
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
