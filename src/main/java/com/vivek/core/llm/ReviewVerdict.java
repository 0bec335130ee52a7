package com.vivek.core.llm;

import java.util.List;

/**
 * Structured reviewer reply.
 *
 * @param score       quality score, 0.0 to 1.0 (scores on a 0-10 scale are rescaled)
 * @param issues      concrete problems found
 * @param suggestions how to fix them
 * @param summary     one-paragraph assessment
 */
public record ReviewVerdict(
    double score,
    List<String> issues,
    List<String> suggestions,
    String summary
) {}
