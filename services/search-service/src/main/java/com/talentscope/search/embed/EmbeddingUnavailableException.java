package com.talentscope.search.embed;

/**
 * Raised when no query vector can be produced. The message is a short machine-readable reason
 * such as {@code embed_timeout} or {@code embed_circuit_open} and is surfaced as the fallback
 * reason of a semantic search.
 */
public class EmbeddingUnavailableException extends RuntimeException {
    private final String reason;

    public EmbeddingUnavailableException(String reason) {
        this(reason, null);
    }

    public EmbeddingUnavailableException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
