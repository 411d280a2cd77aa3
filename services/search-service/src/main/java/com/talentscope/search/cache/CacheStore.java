package com.talentscope.search.cache;

import java.time.Duration;
import java.util.Optional;

public interface CacheStore {
    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    long deleteByPrefix(String prefix);
}
