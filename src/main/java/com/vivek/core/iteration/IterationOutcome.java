package com.vivek.core.iteration;

import com.vivek.core.model.QualityJudgment;

/**
 * An accepted work item: the candidate that passed review, the cycles it took and the verdict.
 */
public record IterationOutcome(String result, int iterations, QualityJudgment judgment) {}
