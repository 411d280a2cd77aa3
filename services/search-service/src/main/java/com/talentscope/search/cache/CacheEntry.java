package com.talentscope.search.cache;

/**
 * A value held by {@link TtlCache} until {@code expiresAtMs}.
 */
public record CacheEntry<V>(V value, long expiresAtMs) {
    public boolean isLiveAt(long nowMs) {
        return nowMs <= expiresAtMs;
    }
}
