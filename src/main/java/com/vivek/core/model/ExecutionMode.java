package com.vivek.core.model;

import java.util.Locale;

/**
 * What a work item generates: implementation code or tests.
 */
public enum ExecutionMode {
    CODER,
    SDET;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode name case-insensitively; blank input defaults to {@link #CODER}.
     */
    public static ExecutionMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CODER;
        }
        return ExecutionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
