package com.talentscope.search;

import com.talentscope.search.cache.SearchCacheProperties;
import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.embed.EmbeddingProperties;
import com.talentscope.search.ratelimit.RateLimitProperties;
import com.talentscope.search.resilience.SearchResilienceProperties;
import com.talentscope.search.retrieval.ScoringProperties;
import com.talentscope.search.security.AuthProperties;
import com.talentscope.search.synonym.SynonymProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    SearchProperties.class,
    SearchCacheProperties.class,
    SynonymProperties.class,
    ScoringProperties.class,
    SearchResilienceProperties.class,
    RateLimitProperties.class,
    AuthProperties.class,
    EmbeddingProperties.class
})
public class SearchServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SearchServiceApplication.class, args);
    }
}
