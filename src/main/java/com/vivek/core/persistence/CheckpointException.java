package com.vivek.core.persistence;

/**
 * Thrown when a run checkpoint cannot be written or read.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
