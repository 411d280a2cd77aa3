package com.talentscope.search.resilience;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {
    private final AtomicLong now = new AtomicLong(0L);

    @Test
    void opensAfterConsecutiveFailures() {
        CircuitBreaker breaker = new CircuitBreaker("vector_search", 3, 1000, now::get);

        breaker.recordFailure();
        breaker.recordFailure();
        assertTrue(breaker.allowRequest());
        breaker.recordFailure();

        assertTrue(breaker.isOpen());
        assertFalse(breaker.allowRequest());
    }

    @Test
    void successResetsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("embedding", 2, 1000, now::get);

        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertFalse(breaker.isOpen());
    }

    @Test
    void halfOpenAllowsSingleTrial() {
        CircuitBreaker breaker = new CircuitBreaker("embedding", 1, 1000, now::get);
        breaker.recordFailure();
        now.addAndGet(1000);

        assertTrue(breaker.allowRequest());
        assertFalse(breaker.allowRequest());

        breaker.recordFailure();
        assertTrue(breaker.isOpen());

        now.addAndGet(1000);
        assertTrue(breaker.allowRequest());
        breaker.recordSuccess();
        assertTrue(breaker.allowRequest());
        assertTrue(breaker.allowRequest());
    }
}
