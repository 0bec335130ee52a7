package com.vivek.core.context;

import java.util.List;

/**
 * Full, serializable copy of a {@link ContextStore}, embedded in run checkpoints.
 */
public record ContextSnapshot(
    List<Session> sessions,
    List<Activity> activities,
    List<Task> tasks,
    List<ContextItem> items,
    ContextCursor cursor,
    long nextSequence
) {
    public ContextSnapshot {
        sessions = sessions != null ? List.copyOf(sessions) : List.of();
        activities = activities != null ? List.copyOf(activities) : List.of();
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        items = items != null ? List.copyOf(items) : List.of();
        cursor = cursor != null ? cursor : ContextCursor.EMPTY;
    }

    public static ContextSnapshot empty() {
        return new ContextSnapshot(List.of(), List.of(), List.of(), List.of(), ContextCursor.EMPTY, 0L);
    }
}
