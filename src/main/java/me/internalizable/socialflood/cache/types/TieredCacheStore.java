package me.internalizable.socialflood.cache.types;

import com.fasterxml.jackson.databind.JavaType;
import lombok.Builder;
import lombok.Getter;
import me.internalizable.socialflood.cache.CacheEntry;
import me.internalizable.socialflood.cache.CacheTierUnavailableException;
import me.internalizable.socialflood.cache.StatisticalCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Two-tier cache: a local L1 in front of an optional shared L2.
 *
 * Lookups go L1, then L2 (backfilling L1), then the caller's compute function. Writes
 * populate both tiers. When L2 fails it is suspended for a cool-down and the store keeps
 * serving from L1 alone.
 *
 * {@link #getOrCompute} does not deduplicate concurrent misses: two callers missing the
 * same key at the same time may both run their compute function. Upstream reads are
 * idempotent, so the last write simply wins.
 */
@Getter
public class TieredCacheStore implements StatisticalCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(TieredCacheStore.class);

    private final LocalCacheStore l1Cache;
    private final RedisCacheStore l2Cache;
    private final Clock clock;
    private final Duration l2FailureCooldown;

    private final AtomicLong l1Hits = new AtomicLong();
    private final AtomicLong l2Hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong l2Failures = new AtomicLong();

    private volatile Instant l2SuspendedUntil = Instant.MIN;

    @Builder
    public TieredCacheStore(LocalCacheStore l1Cache, RedisCacheStore l2Cache, Clock clock, Duration l2FailureCooldown) {
        if (l1Cache == null) {
            throw new IllegalStateException("L1 cache is required");
        }
        this.l1Cache = l1Cache;
        this.l2Cache = l2Cache;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.l2FailureCooldown = l2FailureCooldown != null ? l2FailureCooldown : Duration.ofSeconds(30);
    }

    /**
     * Returns the cached value for {@code key}, or runs {@code compute} and caches its result for {@code ttl}.
     * Failures of {@code compute} propagate and are never cached; a {@code null} result is returned uncached.
     */
    public <V> V getOrCompute(String key, Duration ttl, JavaType valueType, Callable<V> compute) throws Exception {
        Optional<CacheEntry<V>> cached = get(key, valueType);
        if (cached.isPresent()) {
            return cached.get().value();
        }

        logger.debug("Cache miss for key: {}, fetching", key);
        V value = compute.call();
        if (value == null) {
            logger.debug("Fetch for key {} returned nothing, not caching", key);
            return null;
        }

        put(CacheEntry.of(key, value, ttl, clock));
        return value;
    }

    @Override
    public <V> Optional<CacheEntry<V>> get(String key, JavaType valueType) {
        Optional<CacheEntry<V>> l1Result = l1Cache.get(key, valueType);
        if (l1Result.isPresent()) {
            l1Hits.incrementAndGet();
            return l1Result;
        }

        Optional<CacheEntry<V>> l2Result = fromL2(() -> l2Cache.<V>get(key, valueType), Optional.empty());
        if (l2Result.isPresent()) {
            l2Hits.incrementAndGet();
            l1Cache.put(l2Result.get());
            return l2Result;
        }

        misses.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public void put(CacheEntry<?> entry) {
        l1Cache.put(entry);
        onL2(l2 -> l2.put(entry));
    }

    @Override
    public void evict(String key) {
        l1Cache.evict(key);
        onL2(l2 -> l2.evict(key));
    }

    @Override
    public void clear() {
        l1Cache.clear();
        onL2(RedisCacheStore::clear);
    }

    @Override
    public void clearNamespace(String namespacePrefix) {
        l1Cache.clearNamespace(namespacePrefix);
        onL2(l2 -> l2.clearNamespace(namespacePrefix));
    }

    @Override
    public boolean containsKey(String key) {
        return l1Cache.containsKey(key) || fromL2(() -> l2Cache.containsKey(key), false);
    }

    @Override
    public long size() {
        return l1Cache.size();
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();

        stats.put("l1", l1Cache.getStats());
        if (l2Cache != null) {
            stats.put("l2", l2Cache.getStats());
            stats.put("l2_active", isL2Active());
            stats.put("l2_failures", l2Failures.get());
        } else {
            stats.put("l2", "disabled");
        }

        stats.put("l1_hits", l1Hits.get());
        stats.put("l2_hits", l2Hits.get());
        stats.put("total_misses", misses.get());
        stats.put("combined_hit_rate", String.format("%.2f%%", getHitRate()));

        return stats;
    }

    @Override
    public double getHitRate() {
        long hits = getHitCount();
        long total = hits + misses.get();
        return total > 0 ? (double) hits / total * 100 : 0.0;
    }

    @Override
    public long getHitCount() {
        return l1Hits.get() + l2Hits.get();
    }

    @Override
    public long getMissCount() {
        return misses.get();
    }

    /**
     * True when an L2 tier is configured and not suspended after a failure.
     */
    public boolean isL2Active() {
        return l2Cache != null && !clock.instant().isBefore(l2SuspendedUntil);
    }

    private <T> T fromL2(Supplier<T> action, T fallback) {
        if (!isL2Active()) {
            return fallback;
        }
        try {
            return action.get();
        } catch (CacheTierUnavailableException e) {
            suspendL2(e);
            return fallback;
        }
    }

    private void onL2(Consumer<RedisCacheStore> action) {
        if (!isL2Active()) {
            return;
        }
        try {
            action.accept(l2Cache);
        } catch (CacheTierUnavailableException e) {
            suspendL2(e);
        }
    }

    private void suspendL2(CacheTierUnavailableException e) {
        l2Failures.incrementAndGet();
        l2SuspendedUntil = clock.instant().plus(l2FailureCooldown);
        logger.warn("L2 cache unavailable, serving from L1 only for {}: {}", l2FailureCooldown, e.getMessage());
    }
}
