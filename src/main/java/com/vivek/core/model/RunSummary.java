package com.vivek.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final report of a run. Every planned work item appears exactly once with its
 * terminal status and reason.
 */
public record RunSummary(
    String runId,
    RunStatus status,
    List<ItemReport> items,
    List<String> errors
) implements Serializable {

    public RunSummary {
        items = items != null ? List.copyOf(items) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /**
     * Outcome line for a single work item.
     */
    public record ItemReport(
        String itemId,
        String filePath,
        WorkItemStatus status,
        FailureReason failureReason,
        String detail,
        int iterations,
        Double score
    ) implements Serializable {}

    public List<ItemReport> succeeded() {
        return items.stream().filter(i -> i.status() == WorkItemStatus.DONE).toList();
    }

    public List<ItemReport> qualityFailed() {
        return withReason(FailureReason.QUALITY_EXHAUSTED);
    }

    public List<ItemReport> transportFailed() {
        return withReason(FailureReason.TRANSPORT_EXHAUSTED);
    }

    public List<ItemReport> blocked() {
        return withReason(FailureReason.DEPENDENCY_FAILED);
    }

    public boolean allSucceeded() {
        return !items.isEmpty() && succeeded().size() == items.size();
    }

    private List<ItemReport> withReason(FailureReason reason) {
        return items.stream()
                .filter(i -> i.status() == WorkItemStatus.FAILED && i.failureReason() == reason)
                .toList();
    }
}
