package com.talentscope.search.ratelimit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.talentscope.search.security.CallerIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RateLimitGateTest {
    private static final CallerIdentity CALLER = new CallerIdentity("user-1");

    @Mock
    private RateLimiter rateLimiter;

    @Test
    void keysByScopeAndCaller() {
        when(rateLimiter.tryAcquire(anyString(), anyInt(), anyInt())).thenReturn(true);
        RateLimitGate gate = new RateLimitGate(rateLimiter, new RateLimitProperties());

        gate.check(RateLimitScope.SEARCH, CALLER);
        gate.check(RateLimitScope.FEEDBACK, CALLER);

        verify(rateLimiter).tryAcquire("search:user-1", 30, 60);
        verify(rateLimiter).tryAcquire("feedback:user-1", 60, 60);
    }

    @Test
    void rejectionCarriesTheWindowAsRetryAfter() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setWindowSeconds(15);
        when(rateLimiter.tryAcquire("search:user-1", 30, 15)).thenReturn(false);
        RateLimitGate gate = new RateLimitGate(rateLimiter, properties);

        assertThatThrownBy(() -> gate.check(RateLimitScope.SEARCH, CALLER))
            .isInstanceOfSatisfying(
                RateLimitExceededException.class,
                ex -> assertEquals(15, ex.getRetryAfterSeconds())
            );
    }

    @Test
    void disabledGateNeverConsultsTheLimiter() {
        RateLimitProperties properties = new RateLimitProperties();
        properties.setEnabled(false);

        new RateLimitGate(rateLimiter, properties).check(RateLimitScope.SEARCH, CALLER);

        verifyNoInteractions(rateLimiter);
    }
}
