package com.talentscope.search.ratelimit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisRateLimiterTest {
    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisRateLimiter limiter;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        limiter = new RedisRateLimiter(redisTemplate, "ratelimit:");
    }

    @Test
    void firstHitInAWindowSetsTheExpiry() {
        when(valueOperations.increment(startsWith("ratelimit:search:user-1:"))).thenReturn(1L);

        assertTrue(limiter.tryAcquire("search:user-1", 30, 60));

        verify(redisTemplate).expire(startsWith("ratelimit:search:user-1:"), eq(Duration.ofSeconds(60)));
    }

    @Test
    void countsOverTheLimitAreRejected() {
        when(valueOperations.increment(anyString())).thenReturn(31L);

        assertFalse(limiter.tryAcquire("search:user-1", 30, 60));

        verify(redisTemplate, never()).expire(anyString(), eq(Duration.ofSeconds(60)));
    }

    @Test
    void unreachableBackendLetsRequestsThrough() {
        when(valueOperations.increment(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertTrue(limiter.tryAcquire("search:user-1", 30, 60));
    }
}
