package com.talentscope.search.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.rate-limit")
public class RateLimitProperties {
    private boolean enabled = true;
    private String keyPrefix = "ratelimit:";
    private int windowSeconds = 60;
    private int searchPerWindow = 30;
    private int feedbackPerWindow = 60;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getSearchPerWindow() {
        return searchPerWindow;
    }

    public void setSearchPerWindow(int searchPerWindow) {
        this.searchPerWindow = searchPerWindow;
    }

    public int getFeedbackPerWindow() {
        return feedbackPerWindow;
    }

    public void setFeedbackPerWindow(int feedbackPerWindow) {
        this.feedbackPerWindow = feedbackPerWindow;
    }
}
