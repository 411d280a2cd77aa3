package com.talentscope.search.planner;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.validation.ValidatedSearch;
import org.springframework.stereotype.Component;

@Component
public class QueryPlanner {
    private final SearchProperties properties;

    public QueryPlanner(SearchProperties properties) {
        this.properties = properties;
    }

    public SearchPlan plan(ValidatedSearch search) {
        String normalized = search.query().trim();
        int length = normalized.codePointCount(0, normalized.length());
        RetrievalMode mode = length > properties.getSemanticQueryThreshold()
            ? RetrievalMode.SEMANTIC
            : RetrievalMode.KEYWORD;
        boolean parallelSkills = search.filters().skills().size() >= Math.max(2, properties.getParallelMinSkills());
        SkillStrategy strategy = properties.getSkillStrategy() == null
            ? SkillStrategy.PARALLEL_GROUPS
            : properties.getSkillStrategy();
        return new SearchPlan(mode, parallelSkills, strategy);
    }
}
