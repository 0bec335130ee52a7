package com.vivek.core.model;

/**
 * Status of an individual work item within a run.
 */
public enum WorkItemStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
