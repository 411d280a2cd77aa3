package com.talentscope.search.cache;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.cache")
public class SearchCacheProperties {
    private boolean enabled = true;
    private String backend = "memory";
    private String keyPrefix = "search:";
    private int maxEntries = 5000;
    private boolean serveStale = false;
    private List<String> popularTerms = new ArrayList<>(List.of(
        "react", "java", "python", "javascript", "typescript", "node.js", "spring", "aws",
        "프론트엔드", "백엔드", "풀스택", "데이터", "devops"
    ));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public boolean isServeStale() {
        return serveStale;
    }

    public void setServeStale(boolean serveStale) {
        this.serveStale = serveStale;
    }

    public List<String> getPopularTerms() {
        return popularTerms;
    }

    public void setPopularTerms(List<String> popularTerms) {
        this.popularTerms = popularTerms;
    }
}
