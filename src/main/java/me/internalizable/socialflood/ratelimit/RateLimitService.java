package me.internalizable.socialflood.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Per-caller rate limiting policy applied in front of every orchestrated call.
 *
 * Automatically uses distributed Redis rate limiting if configured,
 * falls back to local rate limiting for single-server deployments.
 *
 * Configuration (application.properties):
 * - rate-limit.enabled: Enable/disable rate limiting
 * - rate-limit.use-redis: Use Redis for distributed rate limiting (recommended for production)
 * - rate-limit.requests: Calls allowed per identity per window
 * - rate-limit.window: Window length
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    static final String ANONYMOUS = "anonymous";

    private final RateLimiter rateLimiter;
    private final boolean enabled;
    private final int requests;
    private final Duration window;

    public RateLimitService(
            RateLimiter rateLimiter,
            @Value("${rate-limit.enabled:true}") boolean enabled,
            @Value("${rate-limit.requests:100}") int requests,
            @Value("${rate-limit.window:3600s}") Duration window) {
        if (requests < 1) {
            throw new IllegalArgumentException("rate-limit.requests must be positive, got " + requests);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("rate-limit.window must be positive, got " + window);
        }
        this.rateLimiter = rateLimiter;
        this.enabled = enabled;
        this.requests = requests;
        this.window = window;
    }

    /**
     * Count one call for the identity and decide whether it may proceed.
     */
    public RateLimitDecision checkAndIncrement(String identity) {
        if (!enabled) {
            return RateLimitDecision.unlimited();
        }

        RateLimitDecision decision = rateLimiter.tryConsume(key(identity), requests, window);
        if (!decision.allowed()) {
            logger.info("Rate limit exceeded for identity: {} (retry after {}s)",
                    normalize(identity), decision.retryAfter().toSeconds());
        }
        return decision;
    }

    /**
     * Get rate limit info for HTTP headers
     */
    public RateLimitInfo getRateLimitInfo(String identity) {
        if (!enabled) {
            return new RateLimitInfo(999999, 999999, window.toSeconds());
        }

        long remaining = rateLimiter.getRemainingTokens(key(identity), requests, window);
        return new RateLimitInfo(requests, remaining, window.toSeconds());
    }

    /**
     * Admin: Reset rate limit for an identity
     */
    public void resetLimit(String identity) {
        rateLimiter.reset(key(identity));
        logger.info("Rate limit reset for identity: {}", normalize(identity));
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static String key(String identity) {
        return "api:" + normalize(identity);
    }

    private static String normalize(String identity) {
        return identity == null || identity.isBlank() ? ANONYMOUS : identity.trim();
    }

    /**
     * Rate limit info for response headers
     */
    public record RateLimitInfo(int limit, long remaining, long windowSeconds) {}
}
