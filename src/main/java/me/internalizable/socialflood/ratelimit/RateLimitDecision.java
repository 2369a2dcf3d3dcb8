package me.internalizable.socialflood.ratelimit;

import java.time.Duration;

/**
 * Outcome of one check-and-increment against a rate window.
 *
 * @param allowed    whether the call fits in the current window
 * @param remaining  calls left in the window after this one
 * @param retryAfter time until the window rolls over when blocked, {@link Duration#ZERO} otherwise
 */
public record RateLimitDecision(boolean allowed, long remaining, Duration retryAfter) {

    public RateLimitDecision {
        remaining = Math.max(0, remaining);
        retryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public static RateLimitDecision allowed(long remaining) {
        return new RateLimitDecision(true, remaining, Duration.ZERO);
    }

    public static RateLimitDecision blocked(Duration retryAfter) {
        return new RateLimitDecision(false, 0, retryAfter);
    }

    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Duration.ZERO);
    }
}
