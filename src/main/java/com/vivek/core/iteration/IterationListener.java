package com.vivek.core.iteration;

import com.vivek.core.model.QualityJudgment;
import com.vivek.core.model.WorkItem;

/**
 * Notified after every state transition of an {@link IterationMachine}.
 */
@FunctionalInterface
public interface IterationListener {

    IterationListener NONE = (item, from, to, iterations, judgment) -> { };

    void onTransition(WorkItem item, IterationState from, IterationState to, int iterations,
                      QualityJudgment lastJudgment);
}
