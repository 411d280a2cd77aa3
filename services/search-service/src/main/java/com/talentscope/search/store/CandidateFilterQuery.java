package com.talentscope.search.store;

import com.talentscope.search.validation.CandidateFilters;
import java.util.List;

/**
 * Filtered pattern-match query against the candidate table.
 *
 * @param keywordTerms expanded keyword terms, OR-matched against skills, position, company and name
 * @param skillTerms skill values the candidate skill array must overlap with
 */
public record CandidateFilterQuery(
    String userId,
    List<String> keywordTerms,
    List<String> skillTerms,
    CandidateFilters filters,
    int limit,
    int offset
) {
    public CandidateFilterQuery {
        keywordTerms = keywordTerms == null ? List.of() : List.copyOf(keywordTerms);
        skillTerms = skillTerms == null ? List.of() : List.copyOf(skillTerms);
    }
}
