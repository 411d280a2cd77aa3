package com.talentscope.search.embed;

import com.talentscope.search.resilience.CircuitBreaker;
import com.talentscope.search.resilience.SearchResilienceRegistry;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingService implements EmbeddingProvider {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final LocalHashEmbedder localEmbedder;
    private final EmbeddingCacheService cacheService;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        LocalHashEmbedder localEmbedder,
        EmbeddingCacheService cacheService,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.localEmbedder = localEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs) {
        String prepared = prepare(text);
        if (prepared.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        return cacheService.getOrLoad(prepared, value -> fetch(value, timeBudgetMs));
    }

    String prepare(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text).replaceAll(" ").trim();
        int max = properties.getMaxInputChars();
        if (max > 0 && collapsed.length() > max) {
            collapsed = collapsed.substring(0, max);
        }
        return collapsed;
    }

    private List<Double> fetch(String text, Integer timeBudgetMs) {
        if (properties.getMode() == EmbeddingMode.HTTP) {
            CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
            if (!breaker.allowRequest()) {
                throw new EmbeddingUnavailableException("embed_circuit_open");
            }
            try {
                List<Double> vector = embeddingGateway.embed(text, timeBudgetMs);
                breaker.recordSuccess();
                return vector;
            } catch (EmbeddingUnavailableException ex) {
                breaker.recordFailure();
                throw ex;
            } catch (RuntimeException ex) {
                breaker.recordFailure();
                throw new EmbeddingUnavailableException("embed_client_error", ex);
            }
        }
        return localEmbedder.embed(text);
    }
}
