package me.internalizable.socialflood.cache.types;

import com.fasterxml.jackson.databind.JavaType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.Builder;
import lombok.Getter;
import me.internalizable.socialflood.cache.CacheEntry;
import me.internalizable.socialflood.cache.StatisticalCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * In-process L1 tier. Bounded by entry count, each entry expiring after its own TTL.
 */
@Getter
public class LocalCacheStore implements StatisticalCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalCacheStore.class);

    private final Cache<String, CacheEntry<?>> cache;
    private final String name;
    private final int maxSize;
    private final Clock clock;

    @Builder
    public LocalCacheStore(String name, int maxSize, Clock clock) {
        this.name = name != null ? name : "default";
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.maxSize = maxSize > 0 ? maxSize : 1000;
        this.cache = Caffeine.newBuilder()
                .maximumSize(this.maxSize)
                .expireAfter(new EntryExpiry(this.clock))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(this.clock.millis()))
                .recordStats()
                .build();
    }

    @Override
    public <V> Optional<CacheEntry<V>> get(String key, JavaType valueType) {
        CacheEntry<?> entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        if (valueType != null && !ClassUtils.resolvePrimitiveIfNecessary(valueType.getRawClass()).isInstance(entry.value())) {
            logger.warn("[{}] Entry for key {} holds {}, expected {}; dropping it",
                    name, key, entry.value().getClass().getName(), valueType);
            cache.invalidate(key);
            return Optional.empty();
        }
        logger.trace("[{}] Cache hit for key: {}", name, key);
        return Optional.of(retype(entry));
    }

    // Raw class checked above; type arguments are not reified, so they follow the key's operation.
    @SuppressWarnings("unchecked")
    private static <V> CacheEntry<V> retype(CacheEntry<?> entry) {
        return (CacheEntry<V>) entry;
    }

    @Override
    public void put(CacheEntry<?> entry) {
        cache.put(entry.key(), entry);
        logger.trace("[{}] Cached value for key: {} (ttl {})", name, entry.key(), entry.ttl());
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
        logger.trace("[{}] Evicted key: {}", name, key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        logger.info("[{}] Cache cleared", name);
    }

    @Override
    public void clearNamespace(String namespacePrefix) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.startsWith(namespacePrefix));
        logger.info("[{}] Cleared {} keys with prefix: {}", name, before - cache.asMap().size(), namespacePrefix);
    }

    @Override
    public boolean containsKey(String key) {
        CacheEntry<?> entry = cache.asMap().get(key);
        return entry != null && !entry.isExpiredAt(clock.instant());
    }

    @Override
    public long size() {
        return cache.estimatedSize();
    }

    /**
     * Runs pending evictions and expirations.
     */
    public void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public Map<String, Object> getStats() {
        var stats = cache.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("type", "local");
        result.put("size", cache.estimatedSize());
        result.put("max_size", maxSize);
        result.put("hits", stats.hitCount());
        result.put("misses", stats.missCount());
        result.put("hit_rate", String.format("%.2f%%", stats.hitRate() * 100));
        result.put("evictions", stats.evictionCount());
        return result;
    }

    @Override
    public double getHitRate() {
        return cache.stats().hitRate() * 100;
    }

    @Override
    public long getHitCount() {
        return cache.stats().hitCount();
    }

    @Override
    public long getMissCount() {
        return cache.stats().missCount();
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry<?>> {

        private final Clock clock;

        private EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry<?> entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        // Caffeine expires at elapsed >= duration; the extra nanosecond keeps createdAt + ttl itself live
        private long remainingNanos(CacheEntry<?> entry) {
            return Math.max(1, entry.remainingAt(clock.instant()).toNanos() + 1);
        }
    }
}
