package com.talentscope.search.api.dto;

public class SearchApiResponse {
    private SearchResponse data;
    private SearchMeta meta;

    public SearchApiResponse() {
    }

    public SearchApiResponse(SearchResponse data, SearchMeta meta) {
        this.data = data;
        this.meta = meta;
    }

    public SearchResponse getData() {
        return data;
    }

    public void setData(SearchResponse data) {
        this.data = data;
    }

    public SearchMeta getMeta() {
        return meta;
    }

    public void setMeta(SearchMeta meta) {
        this.meta = meta;
    }
}
