package com.talentscope.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchResponse {
    private List<CandidateSearchResult> results;
    private long total;
    private SearchFacets facets;
    private List<String> parsedKeywords;

    public List<CandidateSearchResult> getResults() {
        return results;
    }

    public void setResults(List<CandidateSearchResult> results) {
        this.results = results;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public SearchFacets getFacets() {
        return facets;
    }

    public void setFacets(SearchFacets facets) {
        this.facets = facets;
    }

    public List<String> getParsedKeywords() {
        return parsedKeywords;
    }

    public void setParsedKeywords(List<String> parsedKeywords) {
        this.parsedKeywords = parsedKeywords;
    }
}
