package com.talentscope.search.validation;

import java.util.List;

public record CandidateFilters(
    Integer expYearsMin,
    Integer expYearsMax,
    List<String> skills,
    String location,
    List<String> companies,
    List<String> excludeCompanies,
    String educationLevel,
    boolean expandSynonyms
) {
    public CandidateFilters {
        skills = skills == null ? List.of() : List.copyOf(skills);
        companies = companies == null ? List.of() : List.copyOf(companies);
        excludeCompanies = excludeCompanies == null ? List.of() : List.copyOf(excludeCompanies);
    }

    public static CandidateFilters none() {
        return new CandidateFilters(null, null, List.of(), null, List.of(), List.of(), null, true);
    }

    public boolean hasAny() {
        return expYearsMin != null
            || expYearsMax != null
            || !skills.isEmpty()
            || location != null
            || !companies.isEmpty()
            || !excludeCompanies.isEmpty()
            || educationLevel != null;
    }
}
