package com.talentscope.search.validation;

import com.talentscope.search.api.dto.SearchFilters;
import com.talentscope.search.api.dto.SearchRequest;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SearchRequestValidator {

    public ValidatedSearch validate(SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        String query = QueryEscaper.stripControlCharacters(request.getQuery());
        if (query == null) {
            throw new InvalidSearchRequestException("query is required");
        }
        query = query.trim();
        if (query.isEmpty()) {
            throw new InvalidSearchRequestException("query must not be empty");
        }
        if (query.length() > SearchLimits.MAX_QUERY_LENGTH) {
            throw new InvalidSearchRequestException(
                "query must be at most " + SearchLimits.MAX_QUERY_LENGTH + " characters"
            );
        }
        CandidateFilters filters = validateFilters(request.getFilters());
        return new ValidatedSearch(query, filters, clampLimit(request.getLimit()), clampOffset(request.getOffset()));
    }

    static int clampLimit(Long limit) {
        if (limit == null) {
            return SearchLimits.DEFAULT_LIMIT;
        }
        return (int) Math.max(SearchLimits.MIN_LIMIT, Math.min(SearchLimits.MAX_LIMIT, limit));
    }

    static int clampOffset(Long offset) {
        if (offset == null) {
            return SearchLimits.MIN_OFFSET;
        }
        return (int) Math.max(SearchLimits.MIN_OFFSET, Math.min(SearchLimits.MAX_OFFSET, offset));
    }

    private CandidateFilters validateFilters(SearchFilters filters) {
        if (filters == null) {
            return CandidateFilters.none();
        }
        Integer expMin = validateExpYears(filters.getExpYearsMin(), "filters.expYearsMin");
        Integer expMax = validateExpYears(filters.getExpYearsMax(), "filters.expYearsMax");
        if (expMin != null && expMax != null && expMin > expMax) {
            throw new InvalidSearchRequestException(
                "filters.expYearsMin must be less than or equal to filters.expYearsMax"
            );
        }
        List<String> skills = cleanList(
            filters.getSkills(), "filters.skills", SearchLimits.MAX_SKILLS, SearchLimits.MAX_SKILL_LENGTH
        );
        List<String> companies = cleanList(
            filters.getCompanies(), "filters.companies", SearchLimits.MAX_COMPANIES, SearchLimits.MAX_COMPANY_LENGTH
        );
        List<String> excludeCompanies = cleanList(
            filters.getExcludeCompanies(),
            "filters.excludeCompanies",
            SearchLimits.MAX_COMPANIES,
            SearchLimits.MAX_COMPANY_LENGTH
        );
        String location = cleanText(filters.getLocation(), "filters.location", SearchLimits.MAX_LOCATION_LENGTH);
        String educationLevel = cleanText(
            filters.getEducationLevel(), "filters.educationLevel", SearchLimits.MAX_EDUCATION_LEVEL_LENGTH
        );
        boolean expandSynonyms = filters.getExpandSynonyms() == null || filters.getExpandSynonyms();
        return new CandidateFilters(
            expMin, expMax, skills, location, companies, excludeCompanies, educationLevel, expandSynonyms
        );
    }

    private Integer validateExpYears(Integer value, String field) {
        if (value == null) {
            return null;
        }
        if (value < SearchLimits.MIN_EXP_YEARS || value > SearchLimits.MAX_EXP_YEARS) {
            throw new InvalidSearchRequestException(
                field + " must be between " + SearchLimits.MIN_EXP_YEARS + " and " + SearchLimits.MAX_EXP_YEARS
            );
        }
        return value;
    }

    private List<String> cleanList(List<String> values, String field, int maxItems, int maxLength) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        if (values.size() > maxItems) {
            throw new InvalidSearchRequestException(field + " must contain at most " + maxItems + " entries");
        }
        List<String> cleaned = new ArrayList<>(values.size());
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            String entry = cleanText(value, field, maxLength);
            if (entry != null && seen.add(entry.toLowerCase(Locale.ROOT))) {
                cleaned.add(entry);
            }
        }
        return cleaned;
    }

    private String cleanText(String value, String field, int maxLength) {
        if (value == null) {
            return null;
        }
        String cleaned = QueryEscaper.stripControlCharacters(value).trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        if (cleaned.length() > maxLength) {
            throw new InvalidSearchRequestException(field + " must be at most " + maxLength + " characters");
        }
        return cleaned;
    }
}
