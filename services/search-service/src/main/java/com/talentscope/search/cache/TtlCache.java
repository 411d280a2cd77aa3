package com.talentscope.search.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Bounded in-process map with per-entry expiry. Once the entry count exceeds {@code maxEntries}
 * expired entries are purged first, then the oldest writes are evicted. A re-written key counts
 * as the newest write.
 */
public class TtlCache<V> {
    private final Map<String, CacheEntry<V>> entries = new LinkedHashMap<>();
    private final int maxEntries;
    private final LongSupplier clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public TtlCache(int maxEntries, LongSupplier clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public synchronized Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isLiveAt(clock.getAsLong())) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public synchronized void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long now = clock.getAsLong();
        entries.remove(key);
        entries.put(key, new CacheEntry<>(value, now + ttlMs));
        if (entries.size() > maxEntries) {
            evict(now);
        }
    }

    public synchronized void remove(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    public synchronized long removeByPrefix(String prefix) {
        long removed = 0;
        Iterator<String> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().startsWith(prefix)) {
                keys.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    private void evict(long now) {
        entries.values().removeIf(entry -> !entry.isLiveAt(now));
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
