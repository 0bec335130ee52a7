package com.vivek.core.model;

/**
 * Why a work item ended in {@link WorkItemStatus#FAILED}.
 */
public enum FailureReason {
    NONE,
    /** Every iteration was reviewed and none met the quality threshold. */
    QUALITY_EXHAUSTED,
    /** The generator or reviewer stayed unreachable after all transport retries. */
    TRANSPORT_EXHAUSTED,
    /** A dependency failed, so the item was never attempted. */
    DEPENDENCY_FAILED
}
