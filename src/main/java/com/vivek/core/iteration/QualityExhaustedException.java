package com.vivek.core.iteration;

import com.vivek.core.model.QualityJudgment;

/**
 * A work item used its whole iteration budget without a passing review.
 */
public class QualityExhaustedException extends RuntimeException {

    private final String itemId;
    private final int iterations;
    private final QualityJudgment lastJudgment;

    public QualityExhaustedException(String itemId, int iterations, QualityJudgment lastJudgment) {
        super("Work item " + itemId + " exhausted " + iterations + " iteration(s); last feedback: "
                + (lastJudgment != null ? lastJudgment.feedback() : ""));
        this.itemId = itemId;
        this.iterations = iterations;
        this.lastJudgment = lastJudgment;
    }

    public String getItemId() {
        return itemId;
    }

    public int getIterations() {
        return iterations;
    }

    public QualityJudgment getLastJudgment() {
        return lastJudgment;
    }

    public String getFeedback() {
        return lastJudgment != null ? lastJudgment.feedback() : "";
    }
}
