package com.vivek.core.scheduler;

/**
 * Thrown when a plan cannot be executed: it is empty, has malformed or duplicate items,
 * references a dependency that does not exist, or contains a cycle. Never retried.
 */
public class PlanInvalidException extends RuntimeException {

    public PlanInvalidException(String message) {
        super(message);
    }

    public PlanInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
