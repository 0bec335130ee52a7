package com.vivek.core.model;

import java.util.Locale;

/**
 * Whether a work item creates a file or edits one that already exists.
 */
public enum FileStatus {
    NEW,
    EXISTING;

    public static FileStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NEW;
        }
        return FileStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
