package com.talentscope.search.synonym;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Skill synonym expansion backed by the {@code skill_synonyms} table.
 *
 * <p>The table is held as an immutable snapshot that is swapped atomically on refresh. Only one
 * thread reloads an expired snapshot; other callers keep reading the previous one. When no
 * snapshot could ever be loaded, expansion degrades to the unexpanded term.
 */
@Service
public class SynonymService {
    private static final Logger logger = LoggerFactory.getLogger(SynonymService.class);

    private final SynonymRepository repository;
    private final SynonymProperties properties;
    private final LongSupplier clock;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile SynonymSnapshot snapshot;

    @Autowired
    public SynonymService(SynonymRepository repository, SynonymProperties properties) {
        this(repository, properties, System::currentTimeMillis);
    }

    SynonymService(SynonymRepository repository, SynonymProperties properties, LongSupplier clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns {@code term} followed by its canonical form and variants, de-duplicated
     * case-insensitively and capped at the configured size. The term itself is always first.
     */
    public List<String> expand(String term) {
        if (term == null || term.isBlank()) {
            return List.of();
        }
        String trimmed = term.trim();
        List<String> expanded = new ArrayList<>();
        expanded.add(trimmed);
        if (!properties.isEnabled()) {
            return expanded;
        }
        Set<String> seen = new HashSet<>();
        seen.add(lower(trimmed));
        int max = Math.max(1, properties.getMaxSynonymsPerTerm());
        SynonymSnapshot current = current();
        Optional<String> canonicalKey = current.canonicalKeyOf(trimmed);
        if (canonicalKey.isPresent()) {
            for (String synonym : current.group(canonicalKey.get())) {
                if (expanded.size() >= max) {
                    break;
                }
                if (seen.add(lower(synonym))) {
                    expanded.add(synonym);
                }
            }
        }
        return List.copyOf(expanded);
    }

    public List<String> expandMany(Collection<String> terms, int maxTerms) {
        List<String> union = new ArrayList<>();
        if (terms == null) {
            return union;
        }
        Set<String> seen = new HashSet<>();
        for (String term : terms) {
            for (String synonym : expand(term)) {
                if (union.size() >= maxTerms) {
                    return union;
                }
                if (seen.add(lower(synonym))) {
                    union.add(synonym);
                }
            }
        }
        return union;
    }

    public String normalize(String term) {
        if (term == null || term.isBlank()) {
            return term;
        }
        String trimmed = term.trim();
        if (!properties.isEnabled()) {
            return trimmed;
        }
        SynonymSnapshot current = current();
        return current.canonicalKeyOf(trimmed)
            .map(key -> current.group(key))
            .filter(group -> !group.isEmpty())
            .map(group -> group.get(0))
            .orElse(trimmed);
    }

    public boolean areSynonyms(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        if (left.trim().equalsIgnoreCase(right.trim())) {
            return true;
        }
        if (!properties.isEnabled()) {
            return false;
        }
        SynonymSnapshot current = current();
        Optional<String> leftKey = current.canonicalKeyOf(left);
        return leftKey.isPresent() && leftKey.equals(current.canonicalKeyOf(right));
    }

    public SynonymStatus refresh() {
        refreshLock.lock();
        try {
            snapshot = load(snapshot);
        } finally {
            refreshLock.unlock();
        }
        return status();
    }

    public SynonymStatus status() {
        SynonymSnapshot current = snapshot;
        if (current == null) {
            return new SynonymStatus(false, false, 0, 0, null, 0);
        }
        long remaining = Math.max(0L, current.getExpiresAtMs() - clock.getAsLong());
        return new SynonymStatus(
            true,
            current.isDegraded(),
            current.canonicalCount(),
            current.variantCount(),
            Instant.ofEpochMilli(current.getLoadedAtMs()).toString(),
            remaining
        );
    }

    private SynonymSnapshot current() {
        SynonymSnapshot current = snapshot;
        long now = clock.getAsLong();
        if (current != null && !current.isExpiredAt(now)) {
            return current;
        }
        if (current != null) {
            if (refreshLock.tryLock()) {
                try {
                    if (snapshot.isExpiredAt(clock.getAsLong())) {
                        snapshot = load(snapshot);
                    }
                } finally {
                    refreshLock.unlock();
                }
            }
            return snapshot;
        }
        refreshLock.lock();
        try {
            if (snapshot == null) {
                snapshot = load(null);
            }
            return snapshot;
        } finally {
            refreshLock.unlock();
        }
    }

    private SynonymSnapshot load(SynonymSnapshot previous) {
        long now = clock.getAsLong();
        int maxEntries = Math.max(1, properties.getMaxEntries());
        try {
            List<SynonymPair> pairs = repository.findAll(maxEntries + 1);
            if (pairs.size() > maxEntries) {
                logger.warn("synonym_cache_truncated max_entries={}", maxEntries);
                pairs = pairs.subList(0, maxEntries);
            }
            SynonymSnapshot loaded = SynonymSnapshot.build(pairs, now, properties.getRefreshTtlMs());
            logger.info(
                "synonym_cache_refreshed canonical_count={} variant_count={}",
                loaded.canonicalCount(),
                loaded.variantCount()
            );
            return loaded;
        } catch (DataAccessException ex) {
            logger.warn(
                "synonym_cache_refresh_failed fallback={} error={}",
                previous == null ? "unexpanded" : "previous_snapshot",
                ex.getMessage()
            );
            long retryAt = now + properties.getFailureRetryMs();
            return previous == null ? SynonymSnapshot.empty(now, properties.getFailureRetryMs()) : previous.retainUntil(retryAt);
        }
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
