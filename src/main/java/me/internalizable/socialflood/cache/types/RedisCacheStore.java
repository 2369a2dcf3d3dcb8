package me.internalizable.socialflood.cache.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Getter;
import me.internalizable.socialflood.cache.CacheEntry;
import me.internalizable.socialflood.cache.CacheTierUnavailableException;
import me.internalizable.socialflood.cache.StatisticalCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared L2 tier backed by Redis. Entries are stored as JSON envelopes carrying their
 * creation time and TTL; Redis expiry is set to the remaining lifetime.
 *
 * Backend failures are reported as {@link CacheTierUnavailableException}.
 */
@Getter
public class RedisCacheStore implements StatisticalCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Clock clock;

    private final AtomicLong hitCount = new AtomicLong();
    private final AtomicLong missCount = new AtomicLong();

    @Builder
    public RedisCacheStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            String keyPrefix,
            Clock clock) {
        if (redisTemplate == null) {
            throw new IllegalStateException("RedisTemplate is required");
        }
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.keyPrefix = keyPrefix != null ? (keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":") : "cache:";
        this.clock = clock != null ? clock : Clock.systemUTC();

        logger.info("RedisCacheStore initialized - prefix: {}", this.keyPrefix);
    }

    @Override
    public <V> Optional<CacheEntry<V>> get(String key, JavaType valueType) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(keyPrefix + key);
        } catch (DataAccessException e) {
            throw new CacheTierUnavailableException("Redis read failed for key " + key, e);
        }

        if (json == null) {
            missCount.incrementAndGet();
            return Optional.empty();
        }

        CacheEntry<V> entry;
        try {
            entry = decode(key, json, valueType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("[Redis] Unreadable entry for key {}, dropping it: {}", key, e.getMessage());
            entry = null;
        }

        if (entry == null) {
            missCount.incrementAndGet();
            evict(key);
            return Optional.empty();
        }

        if (entry.isExpiredAt(clock.instant())) {
            missCount.incrementAndGet();
            return Optional.empty();
        }

        hitCount.incrementAndGet();
        logger.trace("[Redis] Cache hit for key: {}", key);
        return Optional.of(entry);
    }

    /**
     * Returns null for envelopes that parse but carry no usable value.
     */
    private <V> CacheEntry<V> decode(String key, String json, JavaType valueType) throws JsonProcessingException {
        StoredEntry stored = objectMapper.readValue(json, StoredEntry.class);
        if (stored == null || stored.value() == null || stored.value().isNull() || stored.ttlMillis() <= 0) {
            logger.warn("[Redis] Incomplete entry for key {}, dropping it", key);
            return null;
        }

        V value = objectMapper.convertValue(stored.value(), valueType);
        if (value == null) {
            logger.warn("[Redis] Entry for key {} decoded to null, dropping it", key);
            return null;
        }
        return new CacheEntry<>(
                key,
                value,
                Instant.ofEpochMilli(stored.createdAt()),
                Duration.ofMillis(stored.ttlMillis()));
    }

    @Override
    public void put(CacheEntry<?> entry) {
        Duration remaining = entry.remainingAt(clock.instant());
        // PX granularity is a millisecond, a shorter remainder would be sent as an invalid zero expiry
        if (remaining.toMillis() < 1) {
            logger.trace("[Redis] Skipping write for key {}, less than 1ms left", entry.key());
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(new StoredEntry(
                    entry.createdAt().toEpochMilli(),
                    entry.ttl().toMillis(),
                    objectMapper.valueToTree(entry.value())));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("[Redis] Error serializing value for key {}: {}", entry.key(), e.getMessage());
            return;
        }

        try {
            redisTemplate.opsForValue().set(keyPrefix + entry.key(), json, remaining);
            logger.trace("[Redis] Cached value for key: {}", entry.key());
        } catch (DataAccessException e) {
            throw new CacheTierUnavailableException("Redis write failed for key " + entry.key(), e);
        }
    }

    @Override
    public void evict(String key) {
        try {
            redisTemplate.delete(keyPrefix + key);
            logger.trace("[Redis] Evicted key: {}", key);
        } catch (DataAccessException e) {
            throw new CacheTierUnavailableException("Redis delete failed for key " + key, e);
        }
    }

    @Override
    public void clear() {
        deleteMatching(keyPrefix + "*");
        hitCount.set(0);
        missCount.set(0);
    }

    @Override
    public void clearNamespace(String namespacePrefix) {
        deleteMatching(keyPrefix + namespacePrefix + "*");
    }

    @Override
    public boolean containsKey(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(keyPrefix + key));
        } catch (DataAccessException e) {
            throw new CacheTierUnavailableException("Redis lookup failed for key " + key, e);
        }
    }

    @Override
    public long size() {
        try {
            Set<String> keys = redisTemplate.keys(keyPrefix + "*");
            return keys != null ? keys.size() : 0;
        } catch (DataAccessException e) {
            throw new CacheTierUnavailableException("Redis size lookup failed", e);
        }
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("type", "redis");
        stats.put("prefix", keyPrefix);
        stats.put("hits", hitCount.get());
        stats.put("misses", missCount.get());
        stats.put("hit_rate", String.format("%.2f%%", getHitRate()));
        return stats;
    }

    @Override
    public double getHitRate() {
        long hits = hitCount.get();
        long total = hits + missCount.get();
        return total > 0 ? (double) hits / total * 100 : 0.0;
    }

    @Override
    public long getHitCount() {
        return hitCount.get();
    }

    @Override
    public long getMissCount() {
        return missCount.get();
    }

    /**
     * Check if Redis connection is available
     */
    public boolean isAvailable() {
        try {
            var factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return false;
            }
            try (var connection = factory.getConnection()) {
                connection.ping();
            }
            return true;
        } catch (Exception e) {
            return false;
        }
    }

    private void deleteMatching(String pattern) {
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                logger.info("[Redis] Cleared {} keys matching: {}", keys.size(), pattern);
            }
        } catch (DataAccessException e) {
            throw new CacheTierUnavailableException("Redis clear failed for pattern " + pattern, e);
        }
    }

    record StoredEntry(long createdAt, long ttlMillis, JsonNode value) {}
}
