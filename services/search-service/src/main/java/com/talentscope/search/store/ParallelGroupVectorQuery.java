package com.talentscope.search.store;

import java.util.List;

/**
 * Arguments of the {@code search_candidates_parallel} RPC. {@code skillGroups} always holds
 * exactly {@link #SKILL_GROUP_SLOTS} entries; unused slots are {@code null}.
 */
public record ParallelGroupVectorQuery(
    String userId,
    List<Double> embedding,
    int matchCount,
    Integer expYearsMin,
    Integer expYearsMax,
    List<List<String>> skillGroups,
    String location,
    List<String> companies,
    List<String> excludeCompanies,
    String educationLevel
) {
    public static final int SKILL_GROUP_SLOTS = 5;

    public ParallelGroupVectorQuery {
        if (skillGroups == null || skillGroups.size() != SKILL_GROUP_SLOTS) {
            throw new IllegalArgumentException("skillGroups must have " + SKILL_GROUP_SLOTS + " slots");
        }
    }
}
