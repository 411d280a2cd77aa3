package com.talentscope.search.retrieval;

import com.talentscope.search.execution.SearchDeadline;
import com.talentscope.search.planner.SearchPlan;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.List;

public record SearchContext(
    String callerId,
    ValidatedSearch search,
    SearchPlan plan,
    List<String> keywords,
    SearchDeadline deadline
) {
    public SearchContext withDeadline(SearchDeadline replacement) {
        return new SearchContext(callerId, search, plan, keywords, replacement);
    }
}
