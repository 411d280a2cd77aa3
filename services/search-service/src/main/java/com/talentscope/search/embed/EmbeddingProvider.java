package com.talentscope.search.embed;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * Embeds {@code text} within {@code timeBudgetMs} (or the configured timeout when null).
     *
     * @throws EmbeddingUnavailableException when no vector can be produced
     */
    List<Double> embed(String text, Integer timeBudgetMs);
}
