package com.talentscope.search.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.LongSupplier;

public class InMemoryCacheStore implements CacheStore {
    private final TtlCache<String> cache;

    public InMemoryCacheStore(int maxEntries) {
        this.cache = new TtlCache<>(maxEntries);
    }

    public InMemoryCacheStore(int maxEntries, LongSupplier clock) {
        this.cache = new TtlCache<>(maxEntries, clock);
    }

    @Override
    public Optional<String> get(String key) {
        return cache.get(key).map(CacheEntry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, value, ttl.toMillis());
    }

    @Override
    public void delete(String key) {
        cache.remove(key);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        return cache.removeByPrefix(prefix);
    }
}
