package com.talentscope.search.facet;

import com.talentscope.search.api.dto.CandidateSearchResult;
import com.talentscope.search.api.dto.FacetItem;
import com.talentscope.search.api.dto.SearchFacets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Counts skills, companies and experience buckets over the exact result list returned to the
 * caller. Values are counted as stored; no case folding.
 */
@Component
public class FacetAggregator {
    static final int MAX_SKILL_FACETS = 30;
    static final int MAX_COMPANY_FACETS = 20;

    static final String BUCKET_0_3 = "0-3";
    static final String BUCKET_3_5 = "3-5";
    static final String BUCKET_5_10 = "5-10";
    static final String BUCKET_10_PLUS = "10+";

    private static final Comparator<FacetItem> BY_COUNT = Comparator
        .comparingInt(FacetItem::getCount)
        .reversed()
        .thenComparing(FacetItem::getValue);

    public SearchFacets aggregate(List<CandidateSearchResult> results) {
        Map<String, Integer> skills = new HashMap<>();
        Map<String, Integer> companies = new HashMap<>();
        Map<String, Integer> expYears = emptyBuckets();

        for (CandidateSearchResult result : results) {
            if (result.getSkills() != null) {
                for (String skill : result.getSkills()) {
                    if (skill != null && !skill.isBlank()) {
                        skills.merge(skill, 1, Integer::sum);
                    }
                }
            }
            String company = result.getCompany();
            if (company != null && !company.isBlank()) {
                companies.merge(company, 1, Integer::sum);
            }
            expYears.merge(bucketOf(result.getExpYears()), 1, Integer::sum);
        }

        SearchFacets facets = new SearchFacets();
        facets.setSkills(topN(skills, MAX_SKILL_FACETS));
        facets.setCompanies(topN(companies, MAX_COMPANY_FACETS));
        facets.setExpYears(expYears);
        return facets;
    }

    static String bucketOf(Integer expYears) {
        int years = expYears == null ? 0 : expYears;
        if (years < 3) {
            return BUCKET_0_3;
        }
        if (years < 5) {
            return BUCKET_3_5;
        }
        if (years < 10) {
            return BUCKET_5_10;
        }
        return BUCKET_10_PLUS;
    }

    private static Map<String, Integer> emptyBuckets() {
        Map<String, Integer> buckets = new LinkedHashMap<>();
        buckets.put(BUCKET_0_3, 0);
        buckets.put(BUCKET_3_5, 0);
        buckets.put(BUCKET_5_10, 0);
        buckets.put(BUCKET_10_PLUS, 0);
        return buckets;
    }

    private static List<FacetItem> topN(Map<String, Integer> counts, int limit) {
        List<FacetItem> items = new ArrayList<>(counts.size());
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            items.add(new FacetItem(entry.getKey(), entry.getValue()));
        }
        items.sort(BY_COUNT);
        return items.size() > limit ? new ArrayList<>(items.subList(0, limit)) : items;
    }
}
