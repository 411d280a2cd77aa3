package com.talentscope.search.ratelimit;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisRateLimiter implements RateLimiter {
    private static final Logger logger = LoggerFactory.getLogger(RedisRateLimiter.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean tryAcquire(String key, int limit, int windowSeconds) {
        long windowId = System.currentTimeMillis() / 1000L / Math.max(windowSeconds, 1);
        String redisKey = keyPrefix + key + ":" + windowId;
        try {
            Long count = redisTemplate.opsForValue().increment(redisKey);
            if (count != null && count == 1L) {
                redisTemplate.expire(redisKey, Duration.ofSeconds(windowSeconds));
            }
            return count == null || count <= limit;
        } catch (DataAccessException ex) {
            // fail open
            logger.warn("rate_limit_backend_unavailable key={} error={}", key, ex.getMessage());
            return true;
        }
    }
}
