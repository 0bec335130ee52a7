package com.vivek.core.gateway;

import com.vivek.core.model.SamplingParams;

/**
 * Produces a candidate artifact (source file, test file) from a prompt.
 */
@FunctionalInterface
public interface Generator {

    /**
     * @throws com.vivek.core.iteration.TransportException if the backing model cannot be reached
     */
    String generate(String prompt, SamplingParams params);
}
