package me.internalizable.socialflood.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * In-process fixed-window limiter. Each key owns a Bucket4j bucket that refills its full
 * capacity once per window, so the count resets when the window rolls over.
 */
public class LocalRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(LocalRateLimiter.class);

    private final Cache<String, Bucket> bucketCache;
    private final TimeMeter timeMeter;

    public LocalRateLimiter() {
        this(Duration.ofHours(1), TimeMeter.SYSTEM_MILLISECONDS);
    }

    /**
     * @param idleEviction how long an untouched bucket is kept; must be at least one window
     * @param timeMeter    time source for window arithmetic
     */
    public LocalRateLimiter(Duration idleEviction, TimeMeter timeMeter) {
        this.timeMeter = timeMeter;
        this.bucketCache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterAccess(idleEviction)
                .build();
    }

    @Override
    public RateLimitDecision tryConsume(String key, int limit, Duration window) {
        Bucket bucket = bucketCache.get(key, k -> createBucket(limit, window));
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            return RateLimitDecision.allowed(probe.getRemainingTokens());
        }

        Duration retryAfter = Duration.ofNanos(probe.getNanosToWaitForRefill());
        logger.debug("Rate limit hit for key: {} (retry after {})", key, retryAfter);
        return RateLimitDecision.blocked(retryAfter);
    }

    @Override
    public long getRemainingTokens(String key, int limit, Duration window) {
        Bucket bucket = bucketCache.getIfPresent(key);
        return bucket != null ? bucket.getAvailableTokens() : limit;
    }

    @Override
    public void reset(String key) {
        bucketCache.invalidate(key);
    }

    private Bucket createBucket(int limit, Duration window) {
        return Bucket.builder()
                .withCustomTimePrecision(timeMeter)
                .addLimit(Bandwidth.builder()
                        .capacity(limit)
                        .refillIntervally(limit, window)
                        .build())
                .build();
    }
}
