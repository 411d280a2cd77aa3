package com.talentscope.search.cache;

import com.talentscope.search.api.dto.SearchResponse;

public record CachedSearch(SearchResponse data, String searchMode, boolean stale, long ageMs) {
}
