package com.vivek.dispatch.cli;

import com.vivek.core.events.VivekEvent;
import com.vivek.core.model.RunSummary;
import com.vivek.core.model.WorkItemStatus;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Vivek CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) VIVEK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [VIVEK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One line per run event, used while a run is in progress.
     */
    public static void event(VivekEvent event) {
        var payload = event.payload();
        String line = switch (event.eventType()) {
            case VivekEvent.RUN_STARTED -> "@|fg(cyan) [RUN]|@ " + event.runId()
                    + (Boolean.TRUE.equals(payload.get("resumed")) ? " resumed" : " started");
            case VivekEvent.RUN_PLANNED -> "@|fg(cyan) [PLAN]|@ " + payload.get("items") + " work items in "
                    + payload.get("batches") + " batches: " + payload.get("order");
            case VivekEvent.ITEM_STARTED -> "@|fg(blue) [ITEM]|@ " + event.itemId() + " "
                    + payload.get("filePath") + " (" + payload.get("mode") + ")";
            case VivekEvent.ITEM_ITERATION -> payload.containsKey("score") && "REVIEWING".equals(payload.get("from"))
                    ? "  @|fg(yellow) [REVIEW]|@ " + event.itemId() + " iteration " + payload.get("iteration")
                      + " score " + score(payload.get("score")) + " -> " + payload.get("to")
                    : null;
            case VivekEvent.ITEM_ACCEPTED -> "  @|fg(green),bold [ACCEPTED]|@ " + event.itemId() + " after "
                    + payload.get("iterations") + " iteration(s), score " + score(payload.get("score"));
            case VivekEvent.ITEM_FAILED -> "  @|fg(red),bold [FAILED]|@ " + event.itemId() + " "
                    + payload.get("reason") + ": " + payload.get("detail");
            case VivekEvent.RUN_COMPLETED -> "@|fg(green),bold [COMPLETE]|@ " + payload.get("succeeded")
                    + " succeeded, " + payload.get("failed") + " failed";
            case VivekEvent.RUN_FAILED -> "@|fg(red),bold [ABORTED]|@ " + payload.get("error");
            default -> "@|fg(white) [" + event.eventType() + "]|@ " + payload;
        };
        if (line != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        }
    }

    public static void summary(RunSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + summary.runId() + "|@ " + summary.status()));
        System.out.printf("  %-10s %-10s %-20s %-5s %-6s %s%n", "ITEM", "STATUS", "REASON", "ITER", "SCORE", "FILE");
        System.out.println("  " + "-".repeat(76));
        for (var item : summary.items()) {
            String reason = item.status() == WorkItemStatus.FAILED ? item.failureReason().name() : "-";
            System.out.printf("  %-10s %-10s %-20s %-5d %-6s %s%n",
                    item.itemId(), item.status(), reason, item.iterations(), score(item.score()), item.filePath());
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Items: @|fg(green) " + summary.succeeded().size() + " succeeded|@, @|fg(red) "
                + summary.qualityFailed().size() + " quality-failed|@, @|fg(red) "
                + summary.transportFailed().size() + " transport-failed|@, @|fg(yellow) "
                + summary.blocked().size() + " blocked|@"));
        for (String error : summary.errors()) {
            error(error);
        }
    }

    static String score(Object score) {
        if (score instanceof Number n) {
            return String.format(Locale.ROOT, "%.2f", n.doubleValue());
        }
        return "-";
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
