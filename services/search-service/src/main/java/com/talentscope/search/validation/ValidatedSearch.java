package com.talentscope.search.validation;

/**
 * A search request after sanitizing and bounding: query is trimmed and non-empty, filters are
 * range-checked, and pagination is clamped.
 */
public record ValidatedSearch(String query, CandidateFilters filters, int limit, int offset) {
    public int page() {
        return offset / limit + 1;
    }

    /**
     * Rows a fetch-then-slice path needs to serve this page, capped at {@code maxWindow}. Pages
     * starting at or past the window come back empty.
     */
    public int fetchWindow(int maxWindow) {
        long wanted = (long) offset + limit;
        return (int) Math.min(wanted, Math.max(limit, maxWindow));
    }
}
