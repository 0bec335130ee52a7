package com.vivek.core.model;

/**
 * Lifecycle status of an orchestration run.
 */
public enum RunStatus {
    PLANNING,
    EXECUTING,
    COMPLETED,
    FAILED
}
