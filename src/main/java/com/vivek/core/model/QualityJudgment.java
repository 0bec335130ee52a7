package com.vivek.core.model;

import java.io.Serializable;

/**
 * A reviewer's verdict on one candidate output.
 *
 * @param score    quality score in [0, 1]
 * @param passed   whether the score met the threshold the reviewer applied
 * @param feedback what to fix, or why the candidate is acceptable
 */
public record QualityJudgment(double score, boolean passed, String feedback) implements Serializable {

    public QualityJudgment {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
        feedback = feedback != null ? feedback : "";
    }

    /**
     * Builds a judgment whose {@code passed} flag is derived from the given policy.
     */
    public static QualityJudgment of(double score, String feedback, QualityPolicy policy) {
        return new QualityJudgment(score, policy.admits(score), feedback);
    }
}
