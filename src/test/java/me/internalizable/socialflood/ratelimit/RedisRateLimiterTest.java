package me.internalizable.socialflood.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RedisRateLimiterTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    private StringRedisTemplate redisTemplate;
    private RateLimiter fallback;
    private RedisRateLimiter limiter;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        fallback = mock(RateLimiter.class);
        limiter = new RedisRateLimiter(redisTemplate, fallback);
    }

    private void givenScriptReturns(Long result) {
        given(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyString(), anyString()))
                .willReturn(result);
    }

    @Test
    @DisplayName("allowed calls report the calls left in the window")
    void allowed() {
        givenScriptReturns(2L);

        RateLimitDecision decision = limiter.tryConsume("api:alice", 5, WINDOW);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isEqualTo(2);
    }

    @Test
    @DisplayName("blocked calls carry the window's remaining time as retryAfter")
    void blocked() {
        givenScriptReturns(-42_000L);

        RateLimitDecision decision = limiter.tryConsume("api:alice", 5, WINDOW);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.retryAfter()).isEqualTo(Duration.ofSeconds(42));
    }

    @Test
    @DisplayName("the last call of a window is still allowed with nothing left")
    void lastCallAllowed() {
        givenScriptReturns(0L);

        RateLimitDecision decision = limiter.tryConsume("api:alice", 5, WINDOW);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remaining()).isZero();
    }

    @Test
    @DisplayName("a missing script result falls back to the local limiter")
    void nullResultFallsBack() {
        givenScriptReturns(null);
        given(fallback.tryConsume("api:alice", 5, WINDOW)).willReturn(RateLimitDecision.allowed(4));

        assertThat(limiter.tryConsume("api:alice", 5, WINDOW)).isEqualTo(RateLimitDecision.allowed(4));
    }

    @Test
    @DisplayName("redis failures fall back to the local limiter")
    void fallbackOnFailure() {
        given(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyString(), anyString()))
                .willThrow(new RedisConnectionFailureException("connection refused"));
        given(fallback.tryConsume("api:alice", 5, WINDOW)).willReturn(RateLimitDecision.allowed(4));

        RateLimitDecision decision = limiter.tryConsume("api:alice", 5, WINDOW);

        assertThat(decision).isEqualTo(RateLimitDecision.allowed(4));
        verify(fallback).tryConsume("api:alice", 5, WINDOW);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("remaining tokens are derived from the stored counter")
    void remainingTokens() {
        ValueOperations<String, String> valueOps = mock(ValueOperations.class);
        given(redisTemplate.opsForValue()).willReturn(valueOps);
        given(valueOps.get("ratelimit:api:alice")).willReturn("3");

        assertThat(limiter.getRemainingTokens("api:alice", 5, WINDOW)).isEqualTo(2);
        assertThat(limiter.getRemainingTokens("api:bob", 5, WINDOW)).isEqualTo(5);
    }

    @Test
    @DisplayName("reset clears both redis and the fallback")
    void reset() {
        limiter.reset("api:alice");

        verify(redisTemplate).delete(eq("ratelimit:api:alice"));
        verify(fallback).reset("api:alice");
    }
}
