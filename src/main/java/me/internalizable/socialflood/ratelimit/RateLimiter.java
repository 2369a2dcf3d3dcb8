package me.internalizable.socialflood.ratelimit;

import java.time.Duration;

/**
 * Fixed-window request counter keyed by caller identity.
 * Allows switching between local (Bucket4j) and distributed (Redis) rate limiting.
 *
 * Windows are fixed, not sliding: a burst straddling a window boundary can see up to
 * twice the limit across the two windows.
 */
public interface RateLimiter {

    /**
     * Atomically counts one call against the window for {@code key}.
     * @param key The rate limit key (usually endpoint tier + caller identity)
     * @param limit Maximum calls per window
     * @param window Window length
     * @return the decision, with the time to wait when blocked
     */
    RateLimitDecision tryConsume(String key, int limit, Duration window);

    /**
     * Get remaining calls for a key without consuming one
     */
    long getRemainingTokens(String key, int limit, Duration window);

    /**
     * Reset rate limit for a key (useful for testing or admin overrides)
     * @param key The rate limit key
     */
    void reset(String key);
}
