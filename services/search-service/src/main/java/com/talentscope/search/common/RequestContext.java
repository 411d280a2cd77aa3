package com.talentscope.search.common;

/**
 * Correlation ids of the request being served on this thread.
 */
public record RequestContext(String requestId, String traceId, long startedAtNs) {
    public long elapsedMs() {
        return (System.nanoTime() - startedAtNs) / 1_000_000L;
    }
}
