package com.talentscope.search.resilience;

import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker vectorBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embedding", properties.getEmbedFailureThreshold(), properties.getEmbedOpenMs()
        );
        this.vectorBreaker = new CircuitBreaker(
            "vector_search", properties.getVectorFailureThreshold(), properties.getVectorOpenMs()
        );
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getVectorBreaker() {
        return vectorBreaker;
    }
}
