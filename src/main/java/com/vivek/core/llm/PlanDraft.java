package com.vivek.core.llm;

import java.util.List;

/**
 * Structured planner reply.
 */
public record PlanDraft(String summary, List<PlannedItem> workItems) {

    /**
     * @param dependencies zero-based indices of items in {@code workItems} that must run first
     */
    public record PlannedItem(
        String filePath,
        String fileStatus,
        String mode,
        String description,
        List<Integer> dependencies,
        List<String> tags,
        String language
    ) {}
}
