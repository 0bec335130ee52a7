package com.vivek.core.iteration;

/**
 * The executing thread was interrupted while waiting to retry. The interrupt flag is set again
 * before this is thrown; the run stops instead of moving on to the next item.
 */
public class RunInterruptedException extends RuntimeException {

    public RunInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
