package com.talentscope.search.retrieval;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.embed.EmbeddingProvider;
import com.talentscope.search.embed.EmbeddingUnavailableException;
import com.talentscope.search.execution.ParallelTaskGroup;
import com.talentscope.search.execution.SearchTimeoutException;
import com.talentscope.search.planner.SkillGroupPlan;
import com.talentscope.search.planner.SkillGroupPlanner;
import com.talentscope.search.resilience.CircuitBreaker;
import com.talentscope.search.resilience.SearchResilienceRegistry;
import com.talentscope.search.store.CandidateRow;
import com.talentscope.search.store.CandidateSearchRepository;
import com.talentscope.search.store.CandidateStoreException;
import com.talentscope.search.store.ParallelGroupVectorQuery;
import com.talentscope.search.store.SingleGroupVectorQuery;
import com.talentscope.search.synonym.SynonymService;
import com.talentscope.search.validation.CandidateFilters;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds the query and runs one nearest-neighbour RPC. Never throws for embedding, synonym,
 * RPC or deadline failures; those come back as {@link SemanticAttempt#failed(String)} so the
 * caller can degrade to keyword search.
 */
@Component
public class SemanticSearchExecutor {
    private static final Logger logger = LoggerFactory.getLogger(SemanticSearchExecutor.class);

    private final EmbeddingProvider embeddingProvider;
    private final CandidateSearchRepository repository;
    private final SkillGroupPlanner skillGroupPlanner;
    private final SynonymService synonymService;
    private final ParallelTaskGroup parallelTaskGroup;
    private final SearchResilienceRegistry resilienceRegistry;
    private final SearchProperties properties;

    public SemanticSearchExecutor(
        EmbeddingProvider embeddingProvider,
        CandidateSearchRepository repository,
        SkillGroupPlanner skillGroupPlanner,
        SynonymService synonymService,
        ParallelTaskGroup parallelTaskGroup,
        SearchResilienceRegistry resilienceRegistry,
        SearchProperties properties
    ) {
        this.embeddingProvider = embeddingProvider;
        this.repository = repository;
        this.skillGroupPlanner = skillGroupPlanner;
        this.synonymService = synonymService;
        this.parallelTaskGroup = parallelTaskGroup;
        this.resilienceRegistry = resilienceRegistry;
        this.properties = properties;
    }

    public SemanticAttempt execute(SearchContext context) {
        CircuitBreaker vectorBreaker = resilienceRegistry.getVectorBreaker();
        if (vectorBreaker.isOpen()) {
            return SemanticAttempt.failed("vector_circuit_open");
        }
        try {
            return run(context, vectorBreaker);
        } catch (EmbeddingUnavailableException ex) {
            return SemanticAttempt.failed(ex.reason());
        } catch (SearchTimeoutException ex) {
            return SemanticAttempt.failed("deadline_exceeded");
        } catch (CandidateStoreException ex) {
            logger.debug("semantic_rpc_failed error={}", ex.getMessage(), ex);
            return SemanticAttempt.failed("vector_rpc_failed");
        } catch (RuntimeException ex) {
            logger.warn("semantic_search_unexpected_failure error={}", ex.toString(), ex);
            return SemanticAttempt.failed("unexpected_" + ex.getClass().getSimpleName());
        }
    }

    private SemanticAttempt run(SearchContext context, CircuitBreaker vectorBreaker) {
        ValidatedSearch search = context.search();
        CandidateFilters filters = search.filters();
        boolean parallel = context.plan().parallelSkills();
        int embedBudgetMs = (int) Math.min(Integer.MAX_VALUE, context.deadline().remainingMs());

        List<Callable<Object>> preparation = new ArrayList<>(2);
        preparation.add(() -> embeddingProvider.embed(search.query(), embedBudgetMs));
        preparation.add(() -> parallel
            ? skillGroupPlanner.plan(filters.skills(), filters.expandSynonyms())
            : expandSkills(filters));
        List<Object> prepared = parallelTaskGroup.invokeAll("semantic_prepare", preparation, context.deadline());
        List<Double> embedding = castList(prepared.get(0));

        context.deadline().ensureRemaining("vector_search");
        if (!vectorBreaker.allowRequest()) {
            return SemanticAttempt.failed("vector_circuit_open");
        }
        int matchCount = search.fetchWindow(properties.getMaxResultWindow());
        List<CandidateRow> rows;
        SearchPath path;
        try {
            if (parallel) {
                SkillGroupPlan groups = (SkillGroupPlan) prepared.get(1);
                rows = repository.searchByVectorParallel(new ParallelGroupVectorQuery(
                    context.callerId(),
                    embedding,
                    matchCount,
                    filters.expYearsMin(),
                    filters.expYearsMax(),
                    groups.paddedTo(ParallelGroupVectorQuery.SKILL_GROUP_SLOTS),
                    filters.location(),
                    filters.companies(),
                    filters.excludeCompanies(),
                    filters.educationLevel()
                ), context.deadline());
                path = SearchPath.SEMANTIC_PARALLEL;
            } else {
                rows = repository.searchByVector(new SingleGroupVectorQuery(
                    context.callerId(),
                    embedding,
                    matchCount,
                    filters.expYearsMin(),
                    filters.expYearsMax(),
                    castList(prepared.get(1)),
                    filters.location(),
                    filters.companies(),
                    filters.excludeCompanies(),
                    filters.educationLevel()
                ), context.deadline());
                path = SearchPath.SEMANTIC_SINGLE;
            }
            vectorBreaker.recordSuccess();
        } catch (RuntimeException ex) {
            vectorBreaker.recordFailure();
            throw ex;
        }

        List<CandidateRow> page = KeywordSearchExecutor.slice(rows, search.offset(), search.limit());
        List<RankedCandidate> ranked = new ArrayList<>(page.size());
        for (CandidateRow row : page) {
            ranked.add(new RankedCandidate(row, clamp(row.getMatchScore())));
        }
        return SemanticAttempt.succeeded(new ExecutionOutcome(path, ranked, rows.size()));
    }

    private List<String> expandSkills(CandidateFilters filters) {
        if (!filters.expandSynonyms()) {
            return filters.skills();
        }
        return synonymService.expandMany(filters.skills(), properties.getMaxTotalSkillTerms());
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> castList(Object value) {
        return (List<T>) value;
    }

    private static double clamp(Double score) {
        if (score == null || score.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
