package com.talentscope.search.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.talentscope.search.validation.CandidateFilters;
import com.talentscope.search.validation.ValidatedSearch;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class SearchCacheKeyGenerator {
    private static final int CALLER_HASH_LENGTH = 16;

    private final ObjectMapper objectMapper;
    private final SearchCacheProperties properties;

    public SearchCacheKeyGenerator(ObjectMapper objectMapper, SearchCacheProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String key(String callerId, ValidatedSearch search) {
        return callerPrefix(callerId) + CacheKeyUtil.hashJson(objectMapper, normalize(search));
    }

    public String callerPrefix(String callerId) {
        String callerHash = CacheKeyUtil.sha256(callerId == null ? "" : callerId);
        return properties.getKeyPrefix() + callerHash.substring(0, CALLER_HASH_LENGTH) + ":";
    }

    Map<String, Object> normalize(ValidatedSearch search) {
        Map<String, Object> normalized = new TreeMap<>();
        normalized.put("q", search.query().trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
        normalized.put("limit", search.limit());
        normalized.put("offset", search.offset());

        CandidateFilters filters = search.filters();
        putIfPresent(normalized, "expMin", filters.expYearsMin());
        putIfPresent(normalized, "expMax", filters.expYearsMax());
        putSorted(normalized, "skills", filters.skills());
        putSorted(normalized, "companies", filters.companies());
        putSorted(normalized, "excludeCompanies", filters.excludeCompanies());
        if (filters.location() != null) {
            normalized.put("location", filters.location().toLowerCase(Locale.ROOT));
        }
        putIfPresent(normalized, "education", filters.educationLevel());
        if (!filters.expandSynonyms()) {
            normalized.put("expandSynonyms", false);
        }
        return normalized;
    }

    private void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private void putSorted(Map<String, Object> target, String key, List<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        List<String> sorted = new ArrayList<>(values);
        sorted.sort(null);
        target.put(key, sorted);
    }
}
