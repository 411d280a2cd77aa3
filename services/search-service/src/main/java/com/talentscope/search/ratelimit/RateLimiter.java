package com.talentscope.search.ratelimit;

/**
 * Fixed-window counter. Returns {@code false} once {@code limit} permits have been taken for
 * {@code key} in the current window of {@code windowSeconds}.
 */
public interface RateLimiter {
    boolean tryAcquire(String key, int limit, int windowSeconds);
}
