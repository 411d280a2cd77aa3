package com.talentscope.search.cache;

public enum CacheStrategy {
    POPULAR(600, 300),
    FILTERED(180, 60),
    SEMANTIC(480, 120),
    NORMAL(300, 60);

    private final long ttlSeconds;
    private final long staleSeconds;

    CacheStrategy(long ttlSeconds, long staleSeconds) {
        this.ttlSeconds = ttlSeconds;
        this.staleSeconds = staleSeconds;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public long getStaleSeconds() {
        return staleSeconds;
    }

    public long ttlMs() {
        return ttlSeconds * 1000L;
    }

    public long maxAgeMs() {
        return (ttlSeconds + staleSeconds) * 1000L;
    }
}
