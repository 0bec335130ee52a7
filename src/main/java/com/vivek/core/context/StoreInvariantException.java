package com.vivek.core.context;

/**
 * Thrown when a context store operation would break referential integrity:
 * a duplicate id, a missing parent, or a cursor pointing at nothing.
 * Fatal for the current run.
 */
public class StoreInvariantException extends RuntimeException {

    public StoreInvariantException(String message) {
        super(message);
    }
}
