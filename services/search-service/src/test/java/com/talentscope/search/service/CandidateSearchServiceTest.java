package com.talentscope.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscope.search.api.dto.CandidateSearchResult;
import com.talentscope.search.api.dto.SearchApiResponse;
import com.talentscope.search.api.dto.SearchRequest;
import com.talentscope.search.cache.InMemoryCacheStore;
import com.talentscope.search.cache.SearchCacheKeyGenerator;
import com.talentscope.search.cache.SearchCacheProperties;
import com.talentscope.search.cache.SearchCacheService;
import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.facet.FacetAggregator;
import com.talentscope.search.planner.QueryPlanner;
import com.talentscope.search.retrieval.ExecutionOutcome;
import com.talentscope.search.retrieval.KeywordSearchExecutor;
import com.talentscope.search.retrieval.RankedCandidate;
import com.talentscope.search.retrieval.SearchContext;
import com.talentscope.search.retrieval.SearchPath;
import com.talentscope.search.retrieval.SemanticAttempt;
import com.talentscope.search.retrieval.SemanticSearchExecutor;
import com.talentscope.search.security.CallerIdentity;
import com.talentscope.search.store.CandidateRow;
import com.talentscope.search.validation.SearchRequestValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CandidateSearchServiceTest {
    private static final CallerIdentity CALLER = new CallerIdentity("7b0c1f7e-3f7a-4c55-9d1e-2a6f0a1d9e11");
    private static final String LONG_QUERY = "senior backend engineer who built payment systems";

    @Mock
    private SemanticSearchExecutor semanticExecutor;

    @Mock
    private KeywordSearchExecutor keywordExecutor;

    private ExecutorService cacheExecutor;
    private SimpleMeterRegistry meterRegistry;
    private CandidateSearchService service;

    @BeforeEach
    void setUp() {
        cacheExecutor = Executors.newSingleThreadExecutor();
        meterRegistry = new SimpleMeterRegistry();
        ObjectMapper objectMapper = new ObjectMapper();
        SearchProperties properties = new SearchProperties();
        SearchCacheProperties cacheProperties = new SearchCacheProperties();
        service = new CandidateSearchService(
            new SearchRequestValidator(),
            new SearchCacheKeyGenerator(objectMapper, cacheProperties),
            new SearchCacheService(
                new InMemoryCacheStore(100), objectMapper, cacheProperties, properties, cacheExecutor
            ),
            new QueryPlanner(properties),
            semanticExecutor,
            keywordExecutor,
            new CandidateResultMapper(),
            new FacetAggregator(),
            new MatchReasonBuilder(properties),
            new SearchMetrics(meterRegistry),
            properties,
            cacheExecutor
        );
    }

    @AfterEach
    void tearDown() {
        cacheExecutor.shutdownNow();
    }

    @Test
    void semanticFailureDegradesToKeywordFallback() {
        when(semanticExecutor.execute(any(SearchContext.class)))
            .thenReturn(SemanticAttempt.failed("embedding_unavailable"));
        when(keywordExecutor.fallback(any(SearchContext.class))).thenReturn(new ExecutionOutcome(
            SearchPath.SEMANTIC_FALLBACK,
            List.of(new RankedCandidate(row("c1", "Kakao", 0.96), 0.8), new RankedCandidate(row("c2", "Toss", 0.5), 0.75)),
            2
        ));

        SearchApiResponse response = service.search(CALLER, request(LONG_QUERY));

        assertEquals("keyword_fallback", response.getMeta().getSearchMode());
        assertFalse(response.getMeta().isCached());
        assertEquals(2, response.getMeta().getTotal());
        assertThat(response.getData().getResults()).extracting(CandidateSearchResult::getId).containsExactly("c1", "c2");
        assertEquals("high", response.getData().getResults().get(0).getConfidenceLevel());
        assertEquals("low", response.getData().getResults().get(1).getConfidenceLevel());
        assertEquals(1.0, meterRegistry.counter(SearchMetrics.FALLBACK, "reason", "embedding_unavailable").count());
        verify(keywordExecutor, never()).execute(any());
    }

    @Test
    void repeatedKeywordSearchIsServedFromCache() throws Exception {
        when(keywordExecutor.execute(any(SearchContext.class))).thenReturn(new ExecutionOutcome(
            SearchPath.KEYWORD_SINGLE,
            List.of(new RankedCandidate(row("c1", "Kakao", 0.9), 0.9)),
            1
        ));

        SearchApiResponse first = service.search(CALLER, request("Java"));
        flush();
        SearchApiResponse second = service.search(CALLER, request("java"));

        assertFalse(first.getMeta().isCached());
        assertNull(first.getMeta().getCacheAge());
        assertTrue(second.getMeta().isCached());
        assertNotNull(second.getMeta().getCacheAge());
        assertEquals("keyword", second.getMeta().getSearchMode());
        assertThat(second.getData().getResults()).extracting(CandidateSearchResult::getId).containsExactly("c1");
        assertEquals(first.getData().getResults().get(0).getMatchScore(), second.getData().getResults().get(0).getMatchScore());
        verify(keywordExecutor, times(1)).execute(any());
        assertEquals(1.0, meterRegistry.counter(SearchMetrics.CACHE, "result", "hit").count());
    }

    @Test
    void semanticResultsAreSortedAndAnnotated() {
        when(semanticExecutor.execute(any(SearchContext.class))).thenReturn(SemanticAttempt.succeeded(new ExecutionOutcome(
            SearchPath.SEMANTIC_SINGLE,
            List.of(new RankedCandidate(row("c1", "Kakao", 0.9), 0.62), new RankedCandidate(row("c2", "Naver", 0.9), 0.93)),
            2
        )));

        SearchApiResponse response = service.search(CALLER, request(LONG_QUERY));

        List<CandidateSearchResult> results = response.getData().getResults();
        assertThat(results).extracting(CandidateSearchResult::getId).containsExactly("c2", "c1");
        assertThat(results).extracting(CandidateSearchResult::getMatchScore).containsExactly(93, 62);
        assertThat(results).allSatisfy(result -> assertNotNull(result.getMatchReason()));
        assertEquals(2, response.getData().getFacets().getCompanies().size());
        assertEquals("semantic", response.getMeta().getSearchMode());
    }

    @Test
    void invalidatingTheCallerDropsCachedPages() throws Exception {
        when(keywordExecutor.execute(any(SearchContext.class))).thenReturn(new ExecutionOutcome(
            SearchPath.KEYWORD_SINGLE, List.of(), 0
        ));

        service.search(CALLER, request("Kotlin"));
        flush();

        assertEquals(1, service.invalidateCaller(CALLER.userId()));
        SearchApiResponse afterInvalidate = service.search(CALLER, request("Kotlin"));
        assertFalse(afterInvalidate.getMeta().isCached());
        verify(keywordExecutor, times(2)).execute(any());
    }

    private void flush() throws Exception {
        cacheExecutor.submit(() -> { }).get();
    }

    private static SearchRequest request(String query) {
        SearchRequest request = new SearchRequest();
        request.setQuery(query);
        return request;
    }

    private static CandidateRow row(String id, String company, double confidence) {
        CandidateRow row = new CandidateRow();
        row.setId(id);
        row.setName("Candidate " + id);
        row.setLastCompany(company);
        row.setLastPosition("Backend Engineer");
        row.setExpYears(4);
        row.setSkills(List.of("Java", "Kafka"));
        row.setConfidenceScore(confidence);
        return row;
    }
}
