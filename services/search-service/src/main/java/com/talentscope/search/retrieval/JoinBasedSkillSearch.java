package com.talentscope.search.retrieval;

import com.talentscope.search.store.CandidateRow;
import com.talentscope.search.store.CandidateSearchRepository;
import com.talentscope.search.store.CandidateStoreException;
import com.talentscope.search.store.SkillJoinQuery;
import com.talentscope.search.validation.CandidateFilters;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JoinBasedSkillSearch implements SkillSearchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(JoinBasedSkillSearch.class);

    private final CandidateSearchRepository repository;
    private final ParallelGroupSkillSearch parallelFallback;

    public JoinBasedSkillSearch(CandidateSearchRepository repository, ParallelGroupSkillSearch parallelFallback) {
        this.repository = repository;
        this.parallelFallback = parallelFallback;
    }

    @Override
    public SkillSearchResult search(SkillSearchRequest request) {
        CandidateFilters filters = request.filters();
        if (filters.educationLevel() != null) {
            // the join RPC takes no education parameter
            return parallelFallback.search(request);
        }
        SkillJoinQuery query = new SkillJoinQuery(
            request.userId(),
            request.groups().allTerms(),
            request.fetchCount(),
            filters.expYearsMin(),
            filters.expYearsMax(),
            filters.location(),
            filters.companies(),
            filters.excludeCompanies()
        );
        try {
            request.deadline().ensureRemaining("skill_join_search");
            List<CandidateRow> rows = repository.searchBySkillsJoin(query, request.deadline());
            return new SkillSearchResult(SearchPath.KEYWORD_JOIN, rows);
        } catch (CandidateStoreException ex) {
            logger.warn("skill_join_search_failed fallback=parallel_groups error={}", ex.getMessage());
            return parallelFallback.search(request);
        }
    }
}
