package com.talentscope.search.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscope.search.validation.CandidateFilters;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchCacheKeyGeneratorTest {
    private static final String CALLER = "7f1c2a9e-0a4b-4c55-9a51-1f0d6a3b9e10";

    private final SearchCacheKeyGenerator generator =
        new SearchCacheKeyGenerator(new ObjectMapper(), new SearchCacheProperties());

    @Test
    void keyIsIndependentOfFilterOrderAndQueryCase() {
        ValidatedSearch first = search("React Developer", List.of("React", "TypeScript"), List.of("Kakao", "Naver"));
        ValidatedSearch second = search("  react   developer ", List.of("TypeScript", "React"), List.of("Naver", "Kakao"));

        assertEquals(generator.key(CALLER, first), generator.key(CALLER, second));
        assertEquals(generator.key(CALLER, first), generator.key(CALLER, first));
    }

    @Test
    void keyIsScopedByCallerAndPage() {
        ValidatedSearch search = search("java", List.of(), List.of());
        ValidatedSearch nextPage = new ValidatedSearch("java", search.filters(), 20, 20);

        String key = generator.key(CALLER, search);
        assertThat(key).startsWith(generator.callerPrefix(CALLER)).startsWith("search:");
        assertNotEquals(key, generator.key("0b7e7f4e-5c1d-4d1e-8f3c-2a6b7c8d9e01", search));
        assertNotEquals(key, generator.key(CALLER, nextPage));
    }

    @Test
    void includesExpandSynonymsOnlyWhenDisabled() {
        CandidateFilters expanded = CandidateFilters.none();
        CandidateFilters literal = new CandidateFilters(null, null, List.of(), null, List.of(), List.of(), null, false);

        assertThat(generator.normalize(new ValidatedSearch("java", expanded, 20, 0))).doesNotContainKey("expandSynonyms");
        assertThat(generator.normalize(new ValidatedSearch("java", literal, 20, 0))).containsEntry("expandSynonyms", false);
    }

    private static ValidatedSearch search(String query, List<String> skills, List<String> companies) {
        CandidateFilters filters = new CandidateFilters(3, 10, skills, "Seoul", companies, List.of(), null, true);
        return new ValidatedSearch(query, filters, 20, 0);
    }
}
