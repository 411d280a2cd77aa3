package com.talentscope.search.facet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.talentscope.search.api.dto.CandidateSearchResult;
import com.talentscope.search.api.dto.FacetItem;
import com.talentscope.search.api.dto.SearchFacets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FacetAggregatorTest {
    private final FacetAggregator aggregator = new FacetAggregator();

    @Test
    void experienceBucketsSumToResultCount() {
        List<CandidateSearchResult> results = List.of(
            result(0, "Kakao", "Java"),
            result(3, "Kakao", "Java", "Spring"),
            result(5, "Naver", "React"),
            result(9, null, "react"),
            result(10, "Toss"),
            result(25, "Toss")
        );

        SearchFacets facets = aggregator.aggregate(results);

        assertThat(facets.getExpYears()).containsExactly(
            entry("0-3", 1), entry("3-5", 1), entry("5-10", 2), entry("10+", 2)
        );
        int sum = facets.getExpYears().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(results.size(), sum);
    }

    @Test
    void sortsByCountThenValueWithoutCaseFolding() {
        SearchFacets facets = aggregator.aggregate(List.of(
            result(1, "Toss", "Java", "React"),
            result(1, "Kakao", "Java", "react"),
            result(1, "Kakao", "Spring")
        ));

        assertThat(facets.getSkills()).extracting(FacetItem::getValue)
            .containsExactly("Java", "React", "Spring", "react");
        assertThat(facets.getSkills().get(0).getCount()).isEqualTo(2);
        assertThat(facets.getCompanies()).extracting(FacetItem::getValue).containsExactly("Kakao", "Toss");
    }

    @Test
    void truncatesSkillAndCompanyFacets() {
        List<CandidateSearchResult> results = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            results.add(result(2, "Company" + i, "Skill" + i));
        }

        SearchFacets facets = aggregator.aggregate(results);

        assertThat(facets.getSkills()).hasSize(30);
        assertThat(facets.getCompanies()).hasSize(20);
    }

    @Test
    void emptyResultsProduceZeroBuckets() {
        SearchFacets facets = aggregator.aggregate(List.of());

        assertThat(facets.getSkills()).isEmpty();
        assertThat(facets.getExpYears()).containsOnlyKeys("0-3", "3-5", "5-10", "10+");
        assertThat(facets.getExpYears().values()).containsOnly(0);
    }

    private static CandidateSearchResult result(int expYears, String company, String... skills) {
        CandidateSearchResult result = new CandidateSearchResult();
        result.setExpYears(expYears);
        result.setCompany(company);
        result.setSkills(List.of(skills));
        return result;
    }
}
