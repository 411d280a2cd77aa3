package com.talentscope.search.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.talentscope.search.api.dto.SearchResponse;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CachedSearchEntry {
    private String query;
    private CacheStrategy strategy;
    private String searchMode;
    private long createdAt;
    private SearchResponse data;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public CacheStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(CacheStrategy strategy) {
        this.strategy = strategy;
    }

    public String getSearchMode() {
        return searchMode;
    }

    public void setSearchMode(String searchMode) {
        this.searchMode = searchMode;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public SearchResponse getData() {
        return data;
    }

    public void setData(SearchResponse data) {
        this.data = data;
    }
}
