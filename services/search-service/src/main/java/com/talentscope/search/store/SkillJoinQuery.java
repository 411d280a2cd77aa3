package com.talentscope.search.store;

import java.util.List;

/**
 * Arguments of the {@code search_candidates_by_skills} RPC.
 */
public record SkillJoinQuery(
    String userId,
    List<String> skills,
    int matchCount,
    Integer expYearsMin,
    Integer expYearsMax,
    String location,
    List<String> companies,
    List<String> excludeCompanies
) {
}
