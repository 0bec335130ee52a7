package com.vivek.core.gateway;

import com.vivek.core.model.ExecutionMode;
import com.vivek.core.model.QualityJudgment;

/**
 * Judges a candidate against the request it was generated for.
 * <p>
 * The score is authoritative. Callers that enforce a quality threshold derive acceptance from
 * the score and treat {@link QualityJudgment#passed()} as the reviewer's own opinion.
 */
@FunctionalInterface
public interface Reviewer {

    /**
     * @throws com.vivek.core.iteration.TransportException if the backing model cannot be reached
     */
    QualityJudgment review(String request, String candidate);

    /**
     * Review of a candidate produced in the given mode. The default ignores the mode.
     */
    default QualityJudgment review(String request, String candidate, ExecutionMode mode) {
        return review(request, candidate);
    }
}
