package com.talentscope.search.ratelimit;

public enum RateLimitScope {
    SEARCH("search"),
    FEEDBACK("feedback");

    private final String key;

    RateLimitScope(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
