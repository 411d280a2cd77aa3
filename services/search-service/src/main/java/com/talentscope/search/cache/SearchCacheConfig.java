package com.talentscope.search.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class SearchCacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(SearchCacheConfig.class);

    @Bean
    public CacheStore searchCacheStore(
        ObjectProvider<StringRedisTemplate> redisTemplate,
        SearchCacheProperties properties
    ) {
        if ("redis".equalsIgnoreCase(properties.getBackend())) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                return new RedisCacheStore(template);
            }
            logger.warn("search_cache_backend_fallback requested=redis using=memory");
        }
        return new InMemoryCacheStore(properties.getMaxEntries());
    }
}
