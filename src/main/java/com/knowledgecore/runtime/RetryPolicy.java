package com.knowledgecore.runtime;

import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with either linear ({@code base * attempt}) or capped exponential backoff. Only failures
 * accepted by the retry predicate are retried; anything else is rethrown on the first attempt.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private enum Backoff {
        LINEAR,
        EXPONENTIAL
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T> {
        T get() throws Exception;
    }

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Backoff backoff;
    private final Predicate<Exception> retryable;
    private final Sleeper sleeper;

    private RetryPolicy(int maxAttempts,
            long baseBackoffMs,
            long maxBackoffMs,
            Backoff backoff,
            Predicate<Exception> retryable,
            Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.backoff = backoff;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public static RetryPolicy linear(int maxAttempts, long baseBackoffMs, Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, Long.MAX_VALUE, Backoff.LINEAR, e -> true, sleeper);
    }

    public static RetryPolicy exponential(int maxAttempts, long initialBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        return new RetryPolicy(maxAttempts, initialBackoffMs, maxBackoffMs, Backoff.EXPONENTIAL, e -> true, sleeper);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0L, 0L, Backoff.LINEAR, e -> false, Sleeper.SYSTEM);
    }

    public RetryPolicy retryingOn(Predicate<Exception> predicate) {
        return new RetryPolicy(maxAttempts, baseBackoffMs, maxBackoffMs, backoff, predicate, sleeper);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Delay before retry number {@code attempt + 1}, where {@code attempt} is 1-based. */
    public long backoffFor(int attempt) {
        if (backoff == Backoff.LINEAR) {
            return baseBackoffMs * attempt;
        }
        long delay = baseBackoffMs;
        for (int i = 1; i < attempt && delay < maxBackoffMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxBackoffMs);
    }

    public <T> T execute(String operation, ThrowingSupplier<T> supplier) throws Exception {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get();
            } catch (Exception e) {
                last = e;
                if (attempt == maxAttempts || !retryable.test(e)) {
                    break;
                }
                long delay = backoffFor(attempt);
                log.warn("retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    break;
                }
            }
        }
        throw last;
    }

    /** Variant of {@link #execute} for calls that only fail with unchecked exceptions. */
    public <T> T call(String operation, Supplier<T> supplier) {
        try {
            return execute(operation, supplier::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked failure in " + operation, e);
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
