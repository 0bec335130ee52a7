package com.vivek.core.iteration;

/**
 * States of the generate/review loop for one work item.
 */
public enum IterationState {
    PENDING,
    GENERATING,
    REVIEWING,
    REFINING,
    ACCEPTED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED;
    }
}
