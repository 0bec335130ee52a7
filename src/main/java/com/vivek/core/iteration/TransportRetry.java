package com.vivek.core.iteration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Retries a generator or reviewer call on {@link TransportException} with exponential backoff.
 * The delay before retry {@code n} (from 0) is {@code min(backoffMs * multiplier^n, maxBackoffMs)}.
 * Other exceptions propagate immediately. An interrupt during backoff ends the call with
 * {@link RunInterruptedException}.
 */
@Component
public class TransportRetry {

    private static final Logger log = LoggerFactory.getLogger(TransportRetry.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long backoffMs;
    private final long maxBackoffMs;
    private final double multiplier;
    private final Sleeper sleeper;

    @Autowired
    public TransportRetry(QualityProperties properties) {
        this(properties.getRetry().getMaxAttempts(), properties.getRetry().getBackoffMs(),
                properties.getRetry().getMaxBackoffMs(), properties.getRetry().getMultiplier(), Thread::sleep);
    }

    public TransportRetry(int maxAttempts, long backoffMs, long maxBackoffMs, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffMs = Math.max(0, backoffMs);
        this.maxBackoffMs = Math.max(this.backoffMs, maxBackoffMs);
        this.multiplier = Math.max(1.0, multiplier);
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        return execute(operation, call, retry -> { });
    }

    /**
     * Runs {@code call}, retrying transport failures.
     *
     * @param onRetry receives the retry number (1-based) before each retry
     * @throws TransportException       when every attempt failed
     * @throws RunInterruptedException  when interrupted while waiting to retry
     */
    public <T> T execute(String operation, Supplier<T> call, IntConsumer onRetry) {
        TransportException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (TransportException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayBeforeRetry(attempt - 1);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                onRetry.accept(attempt);
                pause(operation, delay, e);
            }
        }
        log.error("{} failed after {} attempt(s)", operation, maxAttempts);
        throw new TransportException(operation + " failed after " + maxAttempts + " attempt(s): "
                + last.getMessage(), last);
    }

    long delayBeforeRetry(int retryIndex) {
        double delay = backoffMs * Math.pow(multiplier, retryIndex);
        return (long) Math.min(delay, maxBackoffMs);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void pause(String operation, long delay, TransportException cause) {
        if (delay <= 0) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            var interrupted = new RunInterruptedException(operation + " interrupted during backoff", ie);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
