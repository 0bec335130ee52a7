package com.vivek.core.model;

import java.io.Serializable;

/**
 * Mutable progress of a work item, kept apart from the immutable {@link WorkItem}.
 * Each transition returns a new instance; this is also the per-item checkpoint record.
 *
 * @param itemId         the work item this state belongs to
 * @param status         current status
 * @param iterationCount generate/review cycles completed so far
 * @param lastJudgment   most recent reviewer verdict (nullable)
 * @param result         accepted candidate output (nullable until done)
 * @param failureReason  why the item failed, {@link FailureReason#NONE} otherwise
 * @param failureDetail  human-readable failure detail (empty unless failed)
 */
public record WorkItemState(
    String itemId,
    WorkItemStatus status,
    int iterationCount,
    QualityJudgment lastJudgment,
    String result,
    FailureReason failureReason,
    String failureDetail
) implements Serializable {

    public WorkItemState {
        status = status != null ? status : WorkItemStatus.PENDING;
        failureReason = failureReason != null ? failureReason : FailureReason.NONE;
        failureDetail = failureDetail != null ? failureDetail : "";
    }

    public static WorkItemState pending(String itemId) {
        return new WorkItemState(itemId, WorkItemStatus.PENDING, 0, null, null, FailureReason.NONE, "");
    }

    public WorkItemState inProgress() {
        return new WorkItemState(itemId, WorkItemStatus.IN_PROGRESS, iterationCount, lastJudgment,
                null, FailureReason.NONE, "");
    }

    public WorkItemState iterated(int iterations, QualityJudgment judgment) {
        return new WorkItemState(itemId, status, iterations, judgment, result, failureReason, failureDetail);
    }

    public WorkItemState done(String acceptedResult, int iterations, QualityJudgment judgment) {
        return new WorkItemState(itemId, WorkItemStatus.DONE, iterations, judgment, acceptedResult,
                FailureReason.NONE, "");
    }

    public WorkItemState failed(FailureReason reason, String detail, int iterations, QualityJudgment judgment) {
        return new WorkItemState(itemId, WorkItemStatus.FAILED, iterations, judgment, null, reason, detail);
    }

    /** Resets an interrupted item so it is attempted again from its first iteration. */
    public WorkItemState resetIfInterrupted() {
        if (status != WorkItemStatus.IN_PROGRESS) {
            return this;
        }
        return pending(itemId);
    }
}
