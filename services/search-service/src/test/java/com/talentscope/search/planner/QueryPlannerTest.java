package com.talentscope.search.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.validation.CandidateFilters;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryPlannerTest {
    private final SearchProperties properties = new SearchProperties();
    private final QueryPlanner planner = new QueryPlanner(properties);

    @Test
    void shortQueriesUseKeywordMode() {
        SearchPlan plan = planner.plan(search("Java", List.of()));

        assertEquals(RetrievalMode.KEYWORD, plan.mode());
        assertFalse(plan.parallelSkills());
    }

    @Test
    void longQueriesUseSemanticMode() {
        String query = "senior backend engineer with payments systems";
        assertEquals(45, query.length());

        assertTrue(planner.plan(search(query, List.of())).isSemantic());
    }

    @Test
    void thresholdCountsCodePoints() {
        assertFalse(planner.plan(search("프론트엔드개발자경력", List.of())).isSemantic());
        assertTrue(planner.plan(search("프론트엔드개발자경력자", List.of())).isSemantic());
        assertFalse(planner.plan(search("\uD83D\uDE00".repeat(6), List.of())).isSemantic());
    }

    @Test
    void twoOrMoreSkillsRunInParallelGroups() {
        assertFalse(planner.plan(search("Java", List.of("Spring"))).parallelSkills());

        SearchPlan plan = planner.plan(search("Java", List.of("Spring", "Kafka", "AWS")));
        assertTrue(plan.parallelSkills());
        assertEquals(SkillStrategy.PARALLEL_GROUPS, plan.skillStrategy());

        properties.setSkillStrategy(SkillStrategy.JOIN);
        assertEquals(SkillStrategy.JOIN, planner.plan(search("Java", List.of("Spring", "Kafka"))).skillStrategy());
    }

    private static ValidatedSearch search(String query, List<String> skills) {
        CandidateFilters filters = new CandidateFilters(null, null, skills, null, List.of(), List.of(), null, true);
        return new ValidatedSearch(query, filters, 20, 0);
    }
}
