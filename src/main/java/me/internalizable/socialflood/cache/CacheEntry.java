package me.internalizable.socialflood.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable cached value. Replaced wholesale on refresh, never mutated.
 */
public record CacheEntry<V>(String key, V value, Instant createdAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
    }

    public static <V> CacheEntry<V> of(String key, V value, Duration ttl, Clock clock) {
        return new CacheEntry<>(key, value, clock.instant(), ttl);
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    /**
     * An entry is still valid at the exact instant {@code createdAt + ttl}.
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt());
    }

    /**
     * Time left before expiry, or {@link Duration#ZERO} once expired.
     */
    public Duration remainingAt(Instant now) {
        Duration remaining = Duration.between(now, expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
