package com.vivek.core.model;

import java.io.Serializable;

/**
 * Sampling parameters handed to a generator.
 *
 * @param temperature sampling temperature, 0.0 to 2.0
 * @param maxTokens   upper bound on generated tokens
 */
public record SamplingParams(double temperature, int maxTokens) implements Serializable {

    public static final SamplingParams DEFAULT = new SamplingParams(0.1, 4096);

    public SamplingParams {
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0, got " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
    }
}
