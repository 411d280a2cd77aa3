package com.talentscope.search.retrieval;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.planner.SkillGroupPlan;
import com.talentscope.search.planner.SkillGroupPlanner;
import com.talentscope.search.planner.SkillStrategy;
import com.talentscope.search.store.CandidateFilterQuery;
import com.talentscope.search.store.CandidateRow;
import com.talentscope.search.store.CandidateSearchRepository;
import com.talentscope.search.synonym.SynonymService;
import com.talentscope.search.validation.CandidateFilters;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class KeywordSearchExecutor {
    private final CandidateSearchRepository repository;
    private final SynonymService synonymService;
    private final SkillGroupPlanner skillGroupPlanner;
    private final ParallelGroupSkillSearch parallelGroupSkillSearch;
    private final JoinBasedSkillSearch joinBasedSkillSearch;
    private final ScoringProperties scoring;
    private final SearchProperties properties;

    public KeywordSearchExecutor(
        CandidateSearchRepository repository,
        SynonymService synonymService,
        SkillGroupPlanner skillGroupPlanner,
        ParallelGroupSkillSearch parallelGroupSkillSearch,
        JoinBasedSkillSearch joinBasedSkillSearch,
        ScoringProperties scoring,
        SearchProperties properties
    ) {
        this.repository = repository;
        this.synonymService = synonymService;
        this.skillGroupPlanner = skillGroupPlanner;
        this.parallelGroupSkillSearch = parallelGroupSkillSearch;
        this.joinBasedSkillSearch = joinBasedSkillSearch;
        this.scoring = scoring;
        this.properties = properties;
    }

    public ExecutionOutcome execute(SearchContext context) {
        ValidatedSearch search = context.search();
        CandidateFilters filters = search.filters();
        List<String> keywordTerms = expandKeywords(context.keywords(), filters.expandSynonyms());
        if (context.plan().parallelSkills()) {
            return executeSkillStrategy(context, keywordTerms);
        }

        List<String> skillTerms = filters.expandSynonyms()
            ? synonymService.expandMany(filters.skills(), properties.getMaxTotalSkillTerms())
            : filters.skills();
        CandidateFilterQuery query = new CandidateFilterQuery(
            context.callerId(), keywordTerms, skillTerms, filters, search.limit(), search.offset()
        );
        context.deadline().ensureRemaining("keyword_search");
        List<CandidateRow> rows = repository.findByKeywords(query, context.deadline());
        long total = isLastPage(search, rows) ? (long) search.offset() + rows.size() : repository.countByKeywords(query, context.deadline());
        return new ExecutionOutcome(SearchPath.KEYWORD_SINGLE, rank(rows, search.offset(), scoring.getKeyword()), total);
    }

    /**
     * Filtered ILIKE search of the raw query over summary and last position, used when the
     * semantic path cannot complete.
     */
    public ExecutionOutcome fallback(SearchContext context) {
        ValidatedSearch search = context.search();
        context.deadline().ensureRemaining("fallback_search");
        List<CandidateRow> rows = repository.findByFallback(
            context.callerId(), search.query(), search.filters(), search.limit(), search.offset(), context.deadline()
        );
        long total = isLastPage(search, rows)
            ? (long) search.offset() + rows.size()
            : repository.countByFallback(context.callerId(), search.query(), search.filters(), context.deadline());
        return new ExecutionOutcome(SearchPath.SEMANTIC_FALLBACK, rank(rows, search.offset(), scoring.getFallback()), total);
    }

    private ExecutionOutcome executeSkillStrategy(SearchContext context, List<String> keywordTerms) {
        ValidatedSearch search = context.search();
        CandidateFilters filters = search.filters();
        SkillGroupPlan groups = skillGroupPlanner.plan(filters.skills(), filters.expandSynonyms());
        SkillSearchRequest request = new SkillSearchRequest(
            context.callerId(), groups, filters, search.fetchWindow(properties.getMaxResultWindow()), context.deadline()
        );
        SkillSearchStrategy strategy = context.plan().skillStrategy() == SkillStrategy.JOIN
            ? joinBasedSkillSearch
            : parallelGroupSkillSearch;
        SkillSearchResult result = strategy.search(request);

        List<CandidateRow> matching = filterByKeywords(result.rows(), keywordTerms);
        List<CandidateRow> page = slice(matching, search.offset(), search.limit());
        return new ExecutionOutcome(result.path(), rank(page, search.offset(), scoring.getKeyword()), matching.size());
    }

    List<String> expandKeywords(List<String> keywords, boolean expandSynonyms) {
        int max = Math.max(1, properties.getMaxKeywordTerms());
        if (expandSynonyms) {
            return synonymService.expandMany(keywords, max);
        }
        return keywords.size() > max ? keywords.subList(0, max) : keywords;
    }

    static List<CandidateRow> filterByKeywords(List<CandidateRow> rows, List<String> keywordTerms) {
        if (keywordTerms.isEmpty()) {
            return rows;
        }
        List<String> needles = new ArrayList<>(keywordTerms.size());
        for (String term : keywordTerms) {
            needles.add(term.toLowerCase(Locale.ROOT));
        }
        List<CandidateRow> matching = new ArrayList<>();
        for (CandidateRow row : rows) {
            if (matchesAny(row, needles)) {
                matching.add(row);
            }
        }
        return matching;
    }

    private static boolean matchesAny(CandidateRow row, List<String> needles) {
        List<String> haystack = new ArrayList<>(row.getSkills().size() + 3);
        for (String skill : row.getSkills()) {
            haystack.add(skill.toLowerCase(Locale.ROOT));
        }
        addLower(haystack, row.getLastPosition());
        addLower(haystack, row.getLastCompany());
        addLower(haystack, row.getName());
        for (String needle : needles) {
            for (String value : haystack) {
                if (value.contains(needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void addLower(List<String> target, String value) {
        if (value != null) {
            target.add(value.toLowerCase(Locale.ROOT));
        }
    }

    static List<CandidateRow> slice(List<CandidateRow> rows, int offset, int limit) {
        if (offset >= rows.size()) {
            return List.of();
        }
        return rows.subList(offset, Math.min(rows.size(), offset + limit));
    }

    private static boolean isLastPage(ValidatedSearch search, List<CandidateRow> rows) {
        return rows.size() < search.limit() && (search.offset() == 0 || !rows.isEmpty());
    }

    static List<RankedCandidate> rank(List<CandidateRow> rows, int offset, ScoringProperties.Decay decay) {
        List<RankedCandidate> ranked = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ranked.add(new RankedCandidate(rows.get(i), decay.scoreAt(offset + i)));
        }
        return ranked;
    }
}
