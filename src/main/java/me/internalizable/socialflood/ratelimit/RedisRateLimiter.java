package me.internalizable.socialflood.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Distributed fixed-window limiter using Redis with a Lua script for atomic operations.
 * Works correctly across multiple servers/load balancers.
 *
 * - Increment, compare and window expiry happen in a single Lua script
 * - Window length is enforced by the key's PX expiry
 * - Falls back to an in-process limiter while Redis is unreachable
 */
public class RedisRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RedisRateLimiter.class);

    private final StringRedisTemplate redisTemplate;
    private final RateLimiter fallback;
    private final DefaultRedisScript<Long> rateLimitScript;

    // returns calls left (>= 0) when allowed, or minus the window's remaining millis when blocked
    private static final String RATE_LIMIT_LUA = """
            local key = KEYS[1]
            local limit = tonumber(ARGV[1])
            local period = tonumber(ARGV[2])

            local current = redis.call('GET', key)

            if current == false then
                redis.call('SET', key, 1, 'PX', period)
                return limit - 1
            end

            current = tonumber(current)
            local ttl = redis.call('PTTL', key)
            if ttl < 0 then
                redis.call('PEXPIRE', key, period)
                ttl = period
            end

            if current < limit then
                redis.call('INCR', key)
                return limit - current - 1
            end

            if ttl < 1 then
                ttl = 1
            end
            return -ttl
            """;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, RateLimiter fallback) {
        this.redisTemplate = redisTemplate;
        this.fallback = fallback;
        this.rateLimitScript = new DefaultRedisScript<>();
        this.rateLimitScript.setScriptText(RATE_LIMIT_LUA);
        this.rateLimitScript.setResultType(Long.class);
    }

    @Override
    public RateLimitDecision tryConsume(String key, int limit, Duration window) {
        try {
            String redisKey = "ratelimit:" + key;
            Long result = redisTemplate.execute(
                    rateLimitScript,
                    List.of(redisKey),
                    String.valueOf(limit),
                    String.valueOf(window.toMillis())
            );
            if (result == null) {
                throw new IllegalStateException("Rate limit script returned no result");
            }

            return result >= 0
                    ? RateLimitDecision.allowed(result)
                    : RateLimitDecision.blocked(Duration.ofMillis(-result));
        } catch (Exception e) {
            logger.error("Redis rate limit error for key: {}, using local fallback", key, e);
            return fallback.tryConsume(key, limit, window);
        }
    }

    @Override
    public long getRemainingTokens(String key, int limit, Duration window) {
        try {
            String redisKey = "ratelimit:" + key;
            String value = redisTemplate.opsForValue().get(redisKey);
            if (value == null) {
                return limit;
            }
            long current = Long.parseLong(value);
            return Math.max(0, limit - current);
        } catch (Exception e) {
            logger.warn("Failed to get remaining tokens for key: {}", key, e);
            return fallback.getRemainingTokens(key, limit, window);
        }
    }

    @Override
    public void reset(String key) {
        fallback.reset(key);
        try {
            String redisKey = "ratelimit:" + key;
            redisTemplate.delete(redisKey);
        } catch (Exception e) {
            logger.error("Failed to reset rate limit for key: {}", key, e);
        }
    }
}
