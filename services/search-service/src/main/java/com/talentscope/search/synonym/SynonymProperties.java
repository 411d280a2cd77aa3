package com.talentscope.search.synonym;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.synonym")
public class SynonymProperties {
    private boolean enabled = true;
    private long refreshTtlMs = 300_000;
    private long failureRetryMs = 30_000;
    private int maxEntries = 10_000;
    private int maxSynonymsPerTerm = 10;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getRefreshTtlMs() {
        return refreshTtlMs;
    }

    public void setRefreshTtlMs(long refreshTtlMs) {
        this.refreshTtlMs = refreshTtlMs;
    }

    public long getFailureRetryMs() {
        return failureRetryMs;
    }

    public void setFailureRetryMs(long failureRetryMs) {
        this.failureRetryMs = failureRetryMs;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public int getMaxSynonymsPerTerm() {
        return maxSynonymsPerTerm;
    }

    public void setMaxSynonymsPerTerm(int maxSynonymsPerTerm) {
        this.maxSynonymsPerTerm = maxSynonymsPerTerm;
    }
}
