package com.talentscope.search.resilience;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Consecutive-failure breaker. After {@code failureThreshold} failures in a row the breaker
 * opens for {@code openDurationMs}; once that elapses a single trial call is let through and its
 * outcome decides whether the breaker closes or opens again.
 */
public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);
    private final AtomicBoolean trialInFlight = new AtomicBoolean(false);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this(name, failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs, LongSupplier clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public boolean allowRequest() {
        long openUntil = openUntilMs.get();
        if (openUntil == 0L) {
            return true;
        }
        if (clock.getAsLong() < openUntil) {
            return false;
        }
        return trialInFlight.compareAndSet(false, true);
    }

    public boolean isOpen() {
        long openUntil = openUntilMs.get();
        return openUntil != 0L && clock.getAsLong() < openUntil;
    }

    public void recordSuccess() {
        failureCount.set(0);
        openUntilMs.set(0L);
        trialInFlight.set(false);
    }

    public void recordFailure() {
        if (trialInFlight.getAndSet(false)) {
            openUntilMs.set(clock.getAsLong() + openDurationMs);
            return;
        }
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(clock.getAsLong() + openDurationMs);
            failureCount.set(0);
        }
    }

    public String getName() {
        return name;
    }
}
