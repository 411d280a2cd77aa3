package com.talentscope.search.synonym;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

final class SynonymSnapshot {
    private final Map<String, String> canonicalByTerm;
    private final Map<String, List<String>> groupsByCanonical;
    private final long loadedAtMs;
    private final long expiresAtMs;
    private final boolean degraded;

    private SynonymSnapshot(
        Map<String, String> canonicalByTerm,
        Map<String, List<String>> groupsByCanonical,
        long loadedAtMs,
        long expiresAtMs,
        boolean degraded
    ) {
        this.canonicalByTerm = canonicalByTerm;
        this.groupsByCanonical = groupsByCanonical;
        this.loadedAtMs = loadedAtMs;
        this.expiresAtMs = expiresAtMs;
        this.degraded = degraded;
    }

    static SynonymSnapshot build(List<SynonymPair> pairs, long nowMs, long ttlMs) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        Map<String, String> reverse = new HashMap<>();
        for (SynonymPair pair : pairs) {
            String canonical = pair.canonical() == null ? "" : pair.canonical().trim();
            String variant = pair.variant() == null ? "" : pair.variant().trim();
            if (canonical.isEmpty()) {
                continue;
            }
            String canonicalKey = lower(canonical);
            List<String> group = groups.computeIfAbsent(canonicalKey, k -> {
                List<String> created = new ArrayList<>();
                created.add(canonical);
                return created;
            });
            reverse.putIfAbsent(canonicalKey, canonicalKey);
            if (!variant.isEmpty() && !containsIgnoreCase(group, variant)) {
                group.add(variant);
                reverse.putIfAbsent(lower(variant), canonicalKey);
            }
        }
        Map<String, List<String>> frozen = new HashMap<>();
        groups.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return new SynonymSnapshot(Map.copyOf(reverse), Map.copyOf(frozen), nowMs, nowMs + ttlMs, false);
    }

    static SynonymSnapshot empty(long nowMs, long retryMs) {
        return new SynonymSnapshot(Map.of(), Map.of(), nowMs, nowMs + retryMs, true);
    }

    SynonymSnapshot retainUntil(long expiresAtMs) {
        return new SynonymSnapshot(canonicalByTerm, groupsByCanonical, loadedAtMs, expiresAtMs, true);
    }

    Optional<String> canonicalKeyOf(String term) {
        if (term == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByTerm.get(lower(term.trim())));
    }

    List<String> group(String canonicalKey) {
        return groupsByCanonical.getOrDefault(canonicalKey, List.of());
    }

    boolean isExpiredAt(long nowMs) {
        return nowMs >= expiresAtMs;
    }

    long getLoadedAtMs() {
        return loadedAtMs;
    }

    long getExpiresAtMs() {
        return expiresAtMs;
    }

    boolean isDegraded() {
        return degraded;
    }

    int canonicalCount() {
        return groupsByCanonical.size();
    }

    int variantCount() {
        int count = 0;
        for (List<String> group : groupsByCanonical.values()) {
            count += group.size() - 1;
        }
        return count;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        for (String value : values) {
            if (value.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
