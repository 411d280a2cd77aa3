package com.talentscope.search.synonym;

public record SynonymStatus(
    boolean loaded,
    boolean degraded,
    int canonicalCount,
    int variantCount,
    String lastRefreshedAt,
    long ttlRemainingMs
) {
}
