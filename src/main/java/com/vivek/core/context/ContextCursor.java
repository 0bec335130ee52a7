package com.vivek.core.context;

/**
 * Identifies the current session, activity and task. Any component may be null.
 */
public record ContextCursor(String sessionId, String activityId, String taskId) {

    public static final ContextCursor EMPTY = new ContextCursor(null, null, null);

    public boolean isEmpty() {
        return sessionId == null && activityId == null && taskId == null;
    }
}
