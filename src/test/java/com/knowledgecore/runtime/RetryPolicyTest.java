package com.knowledgecore.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void shouldBackOffLinearly() {
        RetryPolicy policy = RetryPolicy.linear(3, 1000, delay -> { });

        assertEquals(1000, policy.backoffFor(1));
        assertEquals(2000, policy.backoffFor(2));
        assertEquals(3000, policy.backoffFor(3));
    }

    @Test
    void shouldCapExponentialBackoff() {
        RetryPolicy policy = RetryPolicy.exponential(6, 500, 4000, delay -> { });

        assertEquals(500, policy.backoffFor(1));
        assertEquals(1000, policy.backoffFor(2));
        assertEquals(2000, policy.backoffFor(3));
        assertEquals(4000, policy.backoffFor(4));
        assertEquals(4000, policy.backoffFor(5));
    }

    @Test
    void shouldRetryUntilSuccessAndSleepBetweenAttempts() {
        List<Long> sleeps = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.exponential(3, 500, 4000, sleeps::add);
        AtomicInteger attempts = new AtomicInteger();

        String value = policy.call("flaky", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        });

        assertEquals("done", value);
        assertEquals(List.of(500L, 1000L), sleeps);
    }

    @Test
    void shouldRethrowLastFailureAfterMaxAttempts() {
        RetryPolicy policy = RetryPolicy.linear(2, 10, delay -> { });
        AtomicInteger attempts = new AtomicInteger();

        IllegalStateException failure = assertThrows(IllegalStateException.class, () -> policy.run("always", () -> {
            throw new IllegalStateException("attempt " + attempts.incrementAndGet());
        }));

        assertEquals("attempt 2", failure.getMessage());
    }

    @Test
    void shouldNotRetryFailuresOutsidePredicate() {
        RetryPolicy policy = RetryPolicy.linear(5, 10, delay -> { })
                .retryingOn(e -> e instanceof IllegalStateException);
        AtomicInteger attempts = new AtomicInteger();
        IllegalArgumentException permanent = new IllegalArgumentException("bad input");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> policy.run("permanent", () -> {
            attempts.incrementAndGet();
            throw permanent;
        }));

        assertSame(permanent, thrown);
        assertEquals(1, attempts.get());
    }

    @Test
    void shouldStopRetryingWhenInterrupted() {
        RetryPolicy policy = RetryPolicy.linear(5, 10, delay -> {
            throw new InterruptedException("shutdown");
        });
        AtomicInteger attempts = new AtomicInteger();

        try {
            assertThrows(IllegalStateException.class, () -> policy.run("interrupted", () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("down");
            }));
            assertEquals(1, attempts.get());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
