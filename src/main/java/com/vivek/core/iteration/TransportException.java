package com.vivek.core.iteration;

/**
 * A generator or reviewer could not be reached or returned nothing usable.
 * Retried with bounded backoff before the work item fails.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
