package com.vivek.core.model;

import java.io.Serializable;

/**
 * The quality gate applied to one work item.
 *
 * @param threshold     minimum review score (inclusive) for a candidate to be accepted
 * @param maxIterations generate/review cycles allowed before the item is exhausted
 */
public record QualityPolicy(double threshold, int maxIterations) implements Serializable {

    public static final QualityPolicy DEFAULT = new QualityPolicy(0.7, 3);

    public QualityPolicy {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got " + threshold);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
    }

    public boolean admits(double score) {
        return score >= threshold;
    }
}
