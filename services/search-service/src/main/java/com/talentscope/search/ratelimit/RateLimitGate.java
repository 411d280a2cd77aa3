package com.talentscope.search.ratelimit;

import com.talentscope.search.security.CallerIdentity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
public class RateLimitGate {
    private final RateLimiter rateLimiter;
    private final RateLimitProperties properties;

    @Autowired
    public RateLimitGate(StringRedisTemplate redisTemplate, RateLimitProperties properties) {
        this(new RedisRateLimiter(redisTemplate, properties.getKeyPrefix()), properties);
    }

    RateLimitGate(RateLimiter rateLimiter, RateLimitProperties properties) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    public void check(RateLimitScope scope, CallerIdentity caller) {
        if (!properties.isEnabled()) {
            return;
        }
        int limit = limitFor(scope);
        if (limit <= 0) {
            return;
        }
        String key = scope.key() + ":" + caller.userId();
        if (!rateLimiter.tryAcquire(key, limit, properties.getWindowSeconds())) {
            throw new RateLimitExceededException(properties.getWindowSeconds());
        }
    }

    private int limitFor(RateLimitScope scope) {
        return switch (scope) {
            case SEARCH -> properties.getSearchPerWindow();
            case FEEDBACK -> properties.getFeedbackPerWindow();
        };
    }
}
