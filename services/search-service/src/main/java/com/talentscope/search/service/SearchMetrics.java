package com.talentscope.search.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

@Component
public class SearchMetrics {
    static final String LATENCY = "candidate.search.latency";
    static final String FALLBACK = "candidate.search.fallback";
    static final String CACHE = "candidate.search.cache";

    private final MeterRegistry meterRegistry;

    public SearchMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordLatency(String searchMode, boolean cached, long elapsedMs) {
        Timer.builder(LATENCY)
            .tag("mode", searchMode == null ? "unknown" : searchMode)
            .tag("cached", Boolean.toString(cached))
            .register(meterRegistry)
            .record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    public void recordFallback(String reason) {
        meterRegistry.counter(FALLBACK, "reason", reason == null ? "unknown" : reason).increment();
    }

    public void recordCache(String result) {
        meterRegistry.counter(CACHE, "result", result).increment();
    }
}
