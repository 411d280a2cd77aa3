package com.talentscope.search.retrieval;

import com.talentscope.search.execution.SearchDeadline;
import com.talentscope.search.planner.SkillGroupPlan;
import com.talentscope.search.validation.CandidateFilters;

public record SkillSearchRequest(
    String userId,
    SkillGroupPlan groups,
    CandidateFilters filters,
    int fetchCount,
    SearchDeadline deadline
) {
    public SkillSearchRequest {
        fetchCount = Math.max(1, fetchCount);
    }
}
