package com.vivek.core.context;

/**
 * Kind of fact recorded in the {@link ContextStore}.
 */
public enum ContextCategory {
    SESSION,
    ACTIVITY,
    TASK,
    ACTION,
    DECISION,
    LEARNING,
    RESULT;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
