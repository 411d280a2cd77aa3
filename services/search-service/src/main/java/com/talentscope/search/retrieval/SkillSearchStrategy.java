package com.talentscope.search.retrieval;

/**
 * Keyword-mode retrieval for a multi-skill filter. Implementations return candidates matching
 * at least one skill group, ordered by stored confidence. Different strategies are not expected
 * to rank identically.
 */
public interface SkillSearchStrategy {
    SkillSearchResult search(SkillSearchRequest request);
}
