package com.talentscope.search.service;

import com.talentscope.search.api.dto.CandidateSearchResult;
import com.talentscope.search.api.dto.SearchApiResponse;
import com.talentscope.search.api.dto.SearchMeta;
import com.talentscope.search.api.dto.SearchRequest;
import com.talentscope.search.api.dto.SearchResponse;
import com.talentscope.search.cache.CacheStrategy;
import com.talentscope.search.cache.CachedSearch;
import com.talentscope.search.cache.SearchCacheKeyGenerator;
import com.talentscope.search.cache.SearchCacheService;
import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.execution.SearchDeadline;
import com.talentscope.search.facet.FacetAggregator;
import com.talentscope.search.planner.QueryPlanner;
import com.talentscope.search.planner.SearchPlan;
import com.talentscope.search.retrieval.ExecutionOutcome;
import com.talentscope.search.retrieval.KeywordSearchExecutor;
import com.talentscope.search.retrieval.SearchContext;
import com.talentscope.search.retrieval.SemanticAttempt;
import com.talentscope.search.retrieval.SemanticSearchExecutor;
import com.talentscope.search.security.CallerIdentity;
import com.talentscope.search.validation.KeywordParser;
import com.talentscope.search.validation.SearchRequestValidator;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class CandidateSearchService {
    private static final Logger logger = LoggerFactory.getLogger(CandidateSearchService.class);

    private final SearchRequestValidator validator;
    private final SearchCacheKeyGenerator keyGenerator;
    private final SearchCacheService cacheService;
    private final QueryPlanner queryPlanner;
    private final SemanticSearchExecutor semanticExecutor;
    private final KeywordSearchExecutor keywordExecutor;
    private final CandidateResultMapper resultMapper;
    private final FacetAggregator facetAggregator;
    private final MatchReasonBuilder matchReasonBuilder;
    private final SearchMetrics metrics;
    private final SearchProperties properties;
    private final ExecutorService refreshExecutor;

    public CandidateSearchService(
        SearchRequestValidator validator,
        SearchCacheKeyGenerator keyGenerator,
        SearchCacheService cacheService,
        QueryPlanner queryPlanner,
        SemanticSearchExecutor semanticExecutor,
        KeywordSearchExecutor keywordExecutor,
        CandidateResultMapper resultMapper,
        FacetAggregator facetAggregator,
        MatchReasonBuilder matchReasonBuilder,
        SearchMetrics metrics,
        SearchProperties properties,
        @Qualifier("cacheExecutor") ExecutorService refreshExecutor
    ) {
        this.validator = validator;
        this.keyGenerator = keyGenerator;
        this.cacheService = cacheService;
        this.queryPlanner = queryPlanner;
        this.semanticExecutor = semanticExecutor;
        this.keywordExecutor = keywordExecutor;
        this.resultMapper = resultMapper;
        this.facetAggregator = facetAggregator;
        this.matchReasonBuilder = matchReasonBuilder;
        this.metrics = metrics;
        this.properties = properties;
        this.refreshExecutor = refreshExecutor;
    }

    public SearchApiResponse search(CallerIdentity caller, SearchRequest request) {
        long started = System.nanoTime();
        ValidatedSearch search = validator.validate(request);
        String callerId = caller.userId();

        String cacheKey = cacheService.isEnabled() ? keyGenerator.key(callerId, search) : null;
        CacheStrategy strategy = cacheService.resolveStrategy(search);
        Optional<CachedSearch> cached = cacheService.get(cacheKey, strategy);
        if (cached.isPresent()) {
            CachedSearch hit = cached.get();
            if (!hit.stale()) {
                metrics.recordCache("hit");
                return cachedResponse(search, hit, started);
            }
            if (cacheService.isServeStale()) {
                metrics.recordCache("stale_served");
                scheduleRefresh(callerId, search, cacheKey, strategy);
                return cachedResponse(search, hit, started);
            }
            metrics.recordCache("stale");
        } else if (cacheKey != null) {
            metrics.recordCache("miss");
        }

        LiveSearch live = runLive(callerId, search);
        cacheService.putAsync(cacheKey, strategy, search, live.data(), live.searchMode());

        long tookMs = elapsedMs(started);
        metrics.recordLatency(live.searchMode(), false, tookMs);
        logger.info(
            "search_completed mode={} path={} results={} total={} took_ms={}",
            live.searchMode(),
            live.path(),
            live.data().getResults().size(),
            live.data().getTotal(),
            tookMs
        );

        SearchMeta meta = baseMeta(search, live.data().getTotal(), live.searchMode());
        meta.setCached(false);
        meta.setResponseTime(tookMs);
        return new SearchApiResponse(live.data(), meta);
    }

    /**
     * Removes every cached search of the caller. Returns the number of deleted entries.
     */
    public long invalidateCaller(String callerId) {
        return cacheService.invalidatePrefix(keyGenerator.callerPrefix(callerId));
    }

    LiveSearch runLive(String callerId, ValidatedSearch search) {
        SearchPlan plan = queryPlanner.plan(search);
        List<String> keywords = KeywordParser.parse(search.query());
        SearchDeadline deadline = SearchDeadline.after(properties.getTimeoutMs());
        SearchContext context = new SearchContext(callerId, search, plan, keywords, deadline);

        ExecutionOutcome outcome;
        if (plan.isSemantic()) {
            SemanticAttempt attempt = semanticExecutor.execute(context);
            if (attempt.isSucceeded()) {
                outcome = attempt.getOutcome();
            } else {
                logger.warn(
                    "search_fallback_triggered reason={} query_length={}",
                    attempt.getFailureReason(),
                    search.query().length()
                );
                metrics.recordFallback(attempt.getFailureReason());
                outcome = keywordExecutor.fallback(context.withDeadline(deadline.withFloor(properties.getFallbackFloorMs())));
            }
        } else {
            outcome = keywordExecutor.execute(context);
        }

        List<CandidateSearchResult> results = resultMapper.toResults(outcome.getCandidates());
        results.sort(Comparator.comparingInt(CandidateSearchResult::getMatchScore).reversed());
        matchReasonBuilder.annotate(results, keywords);

        SearchResponse data = new SearchResponse();
        data.setResults(results);
        data.setTotal(outcome.getTotal());
        data.setFacets(facetAggregator.aggregate(results));
        data.setParsedKeywords(keywords);
        return new LiveSearch(data, outcome.getSearchMode(), outcome.getPath().name());
    }

    private void scheduleRefresh(String callerId, ValidatedSearch search, String cacheKey, CacheStrategy strategy) {
        try {
            refreshExecutor.execute(() -> refresh(callerId, search, cacheKey, strategy));
        } catch (RejectedExecutionException ex) {
            logger.warn("search_cache_refresh_rejected error={}", ex.getMessage());
        }
    }

    private void refresh(String callerId, ValidatedSearch search, String cacheKey, CacheStrategy strategy) {
        try {
            LiveSearch live = runLive(callerId, search);
            cacheService.putAsync(cacheKey, strategy, search, live.data(), live.searchMode());
        } catch (RuntimeException ex) {
            logger.warn("search_cache_refresh_failed error={}", ex.getMessage());
        }
    }

    private SearchApiResponse cachedResponse(ValidatedSearch search, CachedSearch hit, long started) {
        metrics.recordLatency(hit.searchMode(), true, elapsedMs(started));
        SearchMeta meta = baseMeta(search, hit.data().getTotal(), hit.searchMode());
        meta.setCached(true);
        meta.setCacheAge(hit.ageMs());
        return new SearchApiResponse(hit.data(), meta);
    }

    private static SearchMeta baseMeta(ValidatedSearch search, long total, String searchMode) {
        SearchMeta meta = new SearchMeta();
        meta.setTotal(total);
        meta.setPage(search.page());
        meta.setLimit(search.limit());
        meta.setSearchMode(searchMode);
        return meta;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    record LiveSearch(SearchResponse data, String searchMode, String path) {
    }
}
