package com.talentscope.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscope.search.api.dto.SearchResponse;
import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.validation.ValidatedSearch;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class SearchCacheService {
    private static final Logger logger = LoggerFactory.getLogger(SearchCacheService.class);

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final SearchCacheProperties properties;
    private final SearchProperties searchProperties;
    private final ExecutorService cacheExecutor;
    private final LongSupplier clock;
    private final Set<String> popularTerms;

    @Autowired
    public SearchCacheService(
        CacheStore store,
        ObjectMapper objectMapper,
        SearchCacheProperties properties,
        SearchProperties searchProperties,
        @Qualifier("cacheExecutor") ExecutorService cacheExecutor
    ) {
        this(store, objectMapper, properties, searchProperties, cacheExecutor, System::currentTimeMillis);
    }

    SearchCacheService(
        CacheStore store,
        ObjectMapper objectMapper,
        SearchCacheProperties properties,
        SearchProperties searchProperties,
        ExecutorService cacheExecutor,
        LongSupplier clock
    ) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.searchProperties = searchProperties;
        this.cacheExecutor = cacheExecutor;
        this.clock = clock;
        this.popularTerms = properties.getPopularTerms() == null
            ? Set.of()
            : properties.getPopularTerms().stream()
                .map(term -> term.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public boolean isServeStale() {
        return properties.isServeStale();
    }

    public CacheStrategy resolveStrategy(ValidatedSearch search) {
        String normalizedQuery = search.query().trim().toLowerCase(Locale.ROOT);
        if (popularTerms.contains(normalizedQuery)) {
            return CacheStrategy.POPULAR;
        }
        if (search.filters().hasAny()) {
            return CacheStrategy.FILTERED;
        }
        if (normalizedQuery.codePointCount(0, normalizedQuery.length()) > searchProperties.getSemanticQueryThreshold()) {
            return CacheStrategy.SEMANTIC;
        }
        return CacheStrategy.NORMAL;
    }

    /**
     * Reads a cached response. Entries past their stale window are deleted and reported as a miss;
     * read failures are treated as a miss as well.
     */
    public Optional<CachedSearch> get(String key, CacheStrategy strategy) {
        if (!isEnabled() || key == null) {
            return Optional.empty();
        }
        try {
            Optional<String> raw = store.get(key);
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            CachedSearchEntry entry = objectMapper.readValue(raw.get(), CachedSearchEntry.class);
            CacheStrategy effective = entry.getStrategy() == null ? strategy : entry.getStrategy();
            long ageMs = Math.max(0L, clock.getAsLong() - entry.getCreatedAt());
            if (ageMs > effective.maxAgeMs() || entry.getData() == null) {
                store.delete(key);
                return Optional.empty();
            }
            boolean stale = ageMs > effective.ttlMs();
            return Optional.of(new CachedSearch(entry.getData(), entry.getSearchMode(), stale, ageMs));
        } catch (JsonProcessingException | RuntimeException ex) {
            logger.warn("search_cache_read_failed error={}", ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Schedules a cache write on the cache executor. Never blocks the caller and never throws.
     */
    public void putAsync(
        String key,
        CacheStrategy strategy,
        ValidatedSearch search,
        SearchResponse data,
        String searchMode
    ) {
        if (!isEnabled() || key == null || data == null) {
            return;
        }
        CachedSearchEntry entry = new CachedSearchEntry();
        entry.setQuery(search.query());
        entry.setStrategy(strategy);
        entry.setSearchMode(searchMode);
        entry.setCreatedAt(clock.getAsLong());
        entry.setData(data);

        String payload;
        try {
            payload = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException ex) {
            logger.warn("search_cache_serialize_failed error={}", ex.getMessage());
            return;
        }
        Duration ttl = Duration.ofMillis(strategy.maxAgeMs());
        try {
            cacheExecutor.execute(() -> write(key, payload, ttl));
        } catch (RejectedExecutionException ex) {
            logger.warn("search_cache_write_rejected error={}", ex.getMessage());
        }
    }

    public long invalidatePrefix(String callerPrefix) {
        long deleted = store.deleteByPrefix(callerPrefix);
        logger.info("search_cache_invalidated prefix={} deleted={}", callerPrefix, deleted);
        return deleted;
    }

    private void write(String key, String payload, Duration ttl) {
        try {
            store.set(key, payload, ttl);
        } catch (RuntimeException ex) {
            logger.warn("search_cache_write_failed error={}", ex.getMessage());
        }
    }
}
