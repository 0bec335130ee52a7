package com.vivek.core.context;

import java.util.List;

/**
 * Context record for a single work item. {@code result} stays null until the task completes.
 */
public record Task(
    String id,
    String activityId,
    String description,
    List<String> tags,
    String result
) {
    public Task {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean completed() {
        return result != null;
    }

    Task withResult(String newResult) {
        return new Task(id, activityId, description, tags, newResult);
    }
}
