package com.talentscope.search.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.execution.ParallelTaskGroup;
import com.talentscope.search.execution.SearchDeadline;
import com.talentscope.search.planner.SkillGroupPlan;
import com.talentscope.search.store.CandidateRow;
import com.talentscope.search.store.CandidateSearchRepository;
import com.talentscope.search.store.CandidateStoreException;
import com.talentscope.search.store.SkillJoinQuery;
import com.talentscope.search.validation.CandidateFilters;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SkillSearchStrategyTest {
    private static final CandidateFilters NO_EDUCATION =
        new CandidateFilters(null, null, List.of("React", "Vue"), null, List.of(), List.of(), null, false);

    @Mock
    private CandidateSearchRepository repository;

    private ExecutorService executor;
    private ParallelGroupSkillSearch parallelSearch;
    private JoinBasedSkillSearch joinSearch;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        parallelSearch = new ParallelGroupSkillSearch(repository, new ParallelTaskGroup(executor), new SearchProperties());
        joinSearch = new JoinBasedSkillSearch(repository, parallelSearch);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parallelGroupsAreDedupedAndOrderedByConfidence() {
        when(repository.findBySkillGroup(eq("user-1"), eq(List.of("React")), eq(NO_EDUCATION), eq(20), any()))
            .thenReturn(List.of(row("c1", 0.7), row("c2", 0.9)));
        when(repository.findBySkillGroup(eq("user-1"), eq(List.of("Vue")), eq(NO_EDUCATION), eq(20), any()))
            .thenReturn(List.of(row("c2", 0.9), row("c3", null), row("c0", 0.7)));

        SkillSearchResult result = parallelSearch.search(request(NO_EDUCATION, 20));

        assertEquals(SearchPath.KEYWORD_PARALLEL_GROUPS, result.path());
        assertThat(result.rows()).extracting(CandidateRow::getId).containsExactly("c2", "c0", "c1", "c3");
    }

    @Test
    void groupLimitStaysWithinTheResultWindow() {
        when(repository.findBySkillGroup(eq("user-1"), any(), eq(NO_EDUCATION), anyInt(), any())).thenReturn(List.of());

        parallelSearch.search(request(NO_EDUCATION, Integer.MAX_VALUE));
        parallelSearch.search(request(NO_EDUCATION, Integer.MIN_VALUE + 19));

        verify(repository, times(2)).findBySkillGroup(eq("user-1"), any(), eq(NO_EDUCATION), eq(510), any());
        verify(repository, times(2)).findBySkillGroup(eq("user-1"), any(), eq(NO_EDUCATION), eq(11), any());
    }

    @Test
    void joinSendsAllTermsInOneCall() {
        when(repository.searchBySkillsJoin(any(SkillJoinQuery.class), any())).thenReturn(List.of(row("c1", 0.8)));

        SkillSearchResult result = joinSearch.search(request(NO_EDUCATION, 20));

        assertEquals(SearchPath.KEYWORD_JOIN, result.path());
        ArgumentCaptor<SkillJoinQuery> captor = ArgumentCaptor.forClass(SkillJoinQuery.class);
        verify(repository).searchBySkillsJoin(captor.capture(), any());
        assertEquals(List.of("React", "Vue"), captor.getValue().skills());
        assertEquals(20, captor.getValue().matchCount());
        verify(repository, never()).findBySkillGroup(any(), any(), any(), eq(20), any());
    }

    @Test
    void joinFailureFallsBackToParallelGroups() {
        when(repository.searchBySkillsJoin(any(SkillJoinQuery.class), any()))
            .thenThrow(new CandidateStoreException("search_candidates_by_skills failed", new IllegalStateException("down")));
        when(repository.findBySkillGroup(eq("user-1"), any(), eq(NO_EDUCATION), eq(15), any())).thenReturn(List.of(row("c1", 0.8)));

        SkillSearchResult result = joinSearch.search(request(NO_EDUCATION, 10));

        assertEquals(SearchPath.KEYWORD_PARALLEL_GROUPS, result.path());
        assertThat(result.rows()).extracting(CandidateRow::getId).containsExactly("c1");
    }

    @Test
    void educationFilterBypassesTheJoin() {
        CandidateFilters withEducation =
            new CandidateFilters(null, null, List.of("React", "Vue"), null, List.of(), List.of(), "master", false);
        when(repository.findBySkillGroup(eq("user-1"), any(), eq(withEducation), eq(15), any())).thenReturn(List.of());

        SkillSearchResult result = joinSearch.search(request(withEducation, 10));

        assertEquals(SearchPath.KEYWORD_PARALLEL_GROUPS, result.path());
        verify(repository, never()).searchBySkillsJoin(any(), any());
    }

    private static SkillSearchRequest request(CandidateFilters filters, int fetchCount) {
        SkillGroupPlan groups = new SkillGroupPlan(List.of(List.of("React"), List.of("Vue")));
        return new SkillSearchRequest("user-1", groups, filters, fetchCount, SearchDeadline.after(5000));
    }

    private static CandidateRow row(String id, Double confidence) {
        CandidateRow row = new CandidateRow();
        row.setId(id);
        row.setSkills(List.of());
        row.setConfidenceScore(confidence);
        return row;
    }
}
