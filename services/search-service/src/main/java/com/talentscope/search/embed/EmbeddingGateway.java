package com.talentscope.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for an OpenAI-compatible {@code /v1/embeddings} endpoint. Retries connection failures,
 * 429 and 5xx with exponential backoff inside the caller's time budget.
 */
@Component
public class EmbeddingGateway {
    private static final Logger logger = LoggerFactory.getLogger(EmbeddingGateway.class);
    static final String EMBEDDINGS_PATH = "/v1/embeddings";

    private final RestTemplateBuilder restTemplateBuilder;
    private final EmbeddingProperties properties;
    private final RestTemplate defaultClient;

    public EmbeddingGateway(RestTemplateBuilder restTemplateBuilder, EmbeddingProperties properties) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.properties = properties;
        this.defaultClient = clientWithTimeout(properties.getTimeoutMs());
    }

    public List<Double> embed(String text, Integer timeBudgetMs) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (isBlank(properties.getBaseUrl())) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        if (isBlank(properties.getApiKey())) {
            throw new EmbeddingUnavailableException("embed_api_key_missing");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(
            new EmbeddingRequest(properties.getModel(), text, properties.getDimensions()),
            headers
        );

        long deadlineMs = timeBudgetMs == null ? Long.MAX_VALUE : System.currentTimeMillis() + timeBudgetMs;
        int maxAttempts = 1 + Math.max(0, properties.getRetryCount());
        EmbeddingUnavailableException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long remainingMs = deadlineMs - System.currentTimeMillis();
            if (remainingMs <= 0) {
                throw new EmbeddingUnavailableException("embed_timeout", lastFailure);
            }
            try {
                EmbeddingResponse body = clientFor(remainingMs).postForObject(endpoint(), entity, EmbeddingResponse.class);
                return vectorOf(body);
            } catch (ResourceAccessException ex) {
                String reason = ex.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
                lastFailure = new EmbeddingUnavailableException(reason, ex);
            } catch (HttpStatusCodeException ex) {
                int status = ex.getStatusCode().value();
                lastFailure = new EmbeddingUnavailableException("embed_http_" + status, ex);
                if (status != 429 && status < 500) {
                    throw lastFailure;
                }
            }
            if (attempt < maxAttempts) {
                long backoffMs = properties.getRetryBackoffMs() << (attempt - 1);
                logger.debug("embed_retry attempt={} reason={} backoff_ms={}", attempt, lastFailure.getMessage(), backoffMs);
                pause(backoffMs);
            }
        }
        throw lastFailure;
    }

    List<Double> vectorOf(EmbeddingResponse body) {
        if (body == null || body.data() == null || body.data().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.data().get(0).embedding();
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        if (properties.getDimensions() > 0 && vector.size() != properties.getDimensions()) {
            throw new EmbeddingUnavailableException("embed_dimension_mismatch_" + vector.size());
        }
        return vector;
    }

    private RestTemplate clientFor(long remainingMs) {
        return remainingMs >= properties.getTimeoutMs() ? defaultClient : clientWithTimeout(remainingMs);
    }

    private RestTemplate clientWithTimeout(long timeoutMs) {
        Duration timeout = Duration.ofMillis(Math.max(1L, timeoutMs));
        return restTemplateBuilder
            .setConnectTimeout(timeout)
            .setReadTimeout(timeout)
            .build();
    }

    private String endpoint() {
        String base = properties.getBaseUrl().trim();
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + EMBEDDINGS_PATH;
    }

    private static void pause(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new EmbeddingUnavailableException("embed_interrupted", ex);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record EmbeddingRequest(String model, String input, Integer dimensions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmbeddingData(int index, List<Double> embedding) {
    }
}
