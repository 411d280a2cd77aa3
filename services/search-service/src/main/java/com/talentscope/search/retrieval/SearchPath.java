package com.talentscope.search.retrieval;

public enum SearchPath {
    SEMANTIC_SINGLE("semantic"),
    SEMANTIC_PARALLEL("semantic"),
    KEYWORD_SINGLE("keyword"),
    KEYWORD_PARALLEL_GROUPS("keyword"),
    KEYWORD_JOIN("keyword"),
    SEMANTIC_FALLBACK("keyword_fallback");

    private final String searchMode;

    SearchPath(String searchMode) {
        this.searchMode = searchMode;
    }

    public String getSearchMode() {
        return searchMode;
    }
}
