package com.vivek.core.iteration;

import com.vivek.core.model.QualityJudgment;

/**
 * Finite-state machine behind {@link IterationController}.
 *
 * <pre>
 * PENDING -> GENERATING -> REVIEWING -> ACCEPTED
 *                 ^              |
 *                 |              v
 *              REFINING <--------+----> EXHAUSTED
 * </pre>
 *
 * The iteration count is the number of completed generate/review cycles. A failed review
 * moves to EXHAUSTED once the count reaches the budget. Transport failure exhausts from
 * GENERATING or REVIEWING.
 */
public class IterationMachine {

    private final int maxIterations;
    private IterationState state = IterationState.PENDING;
    private int iterations;
    private QualityJudgment lastJudgment;
    private boolean transportFailure;

    public IterationMachine(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public IterationState startGenerating() {
        require(state == IterationState.PENDING || state == IterationState.REFINING, "start generating");
        return state = IterationState.GENERATING;
    }

    public IterationState candidateGenerated() {
        require(state == IterationState.GENERATING, "review a candidate");
        return state = IterationState.REVIEWING;
    }

    public IterationState judged(QualityJudgment judgment) {
        require(state == IterationState.REVIEWING, "record a judgment");
        iterations++;
        lastJudgment = judgment;
        if (judgment.passed()) {
            state = IterationState.ACCEPTED;
        } else if (iterations >= maxIterations) {
            state = IterationState.EXHAUSTED;
        } else {
            state = IterationState.REFINING;
        }
        return state;
    }

    public IterationState transportFailed() {
        require(state == IterationState.GENERATING || state == IterationState.REVIEWING, "fail on transport");
        transportFailure = true;
        return state = IterationState.EXHAUSTED;
    }

    public IterationState state() {
        return state;
    }

    public int iterations() {
        return iterations;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public QualityJudgment lastJudgment() {
        return lastJudgment;
    }

    public boolean exhaustedByTransport() {
        return transportFailure;
    }

    private void require(boolean allowed, String action) {
        if (!allowed) {
            throw new IllegalStateException("Cannot " + action + " in state " + state);
        }
    }
}
