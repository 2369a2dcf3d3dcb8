package me.internalizable.socialflood.config;

import io.github.bucket4j.TimeMeter;
import me.internalizable.socialflood.ratelimit.LocalRateLimiter;
import me.internalizable.socialflood.ratelimit.RateLimiter;
import me.internalizable.socialflood.ratelimit.RedisRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Configuration
public class RateLimitConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    @ConditionalOnProperty(
            name = "rate-limit.use-redis",
            havingValue = "true",
            matchIfMissing = false
    )
    public RateLimiter redisRateLimiter(
            StringRedisTemplate redisTemplate,
            @Value("${rate-limit.window:3600s}") Duration window) {
        logger.info("Using Redis rate limiter with local fallback");
        return new RedisRateLimiter(redisTemplate, localLimiter(window));
    }

    @Bean
    @ConditionalOnProperty(
            name = "rate-limit.use-redis",
            havingValue = "false",
            matchIfMissing = true
    )
    public RateLimiter localRateLimiter(@Value("${rate-limit.window:3600s}") Duration window) {
        logger.info("Using local rate limiter");
        return localLimiter(window);
    }

    // buckets must outlive their window or an idle caller would get a fresh allowance early
    private static LocalRateLimiter localLimiter(Duration window) {
        Duration idleEviction = window.compareTo(Duration.ofHours(1)) > 0 ? window : Duration.ofHours(1);
        return new LocalRateLimiter(idleEviction, TimeMeter.SYSTEM_MILLISECONDS);
    }
}
