package com.talentscope.search.store;

import java.util.List;

/**
 * Arguments of the {@code search_candidates} RPC.
 */
public record SingleGroupVectorQuery(
    String userId,
    List<Double> embedding,
    int matchCount,
    Integer expYearsMin,
    Integer expYearsMax,
    List<String> skills,
    String location,
    List<String> companies,
    List<String> excludeCompanies,
    String educationLevel
) {
}
