package me.internalizable.socialflood.cache.types;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import me.internalizable.socialflood.cache.CacheEntry;
import me.internalizable.socialflood.cache.CacheTierUnavailableException;
import me.internalizable.socialflood.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TieredCacheStoreTest {

    private static final JavaType STRING = TypeFactory.defaultInstance().constructType(String.class);
    private static final Duration TTL = Duration.ofSeconds(10);

    private MutableClock clock;
    private LocalCacheStore l1;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        l1 = LocalCacheStore.builder().name("l1").maxSize(100).clock(clock).build();
    }

    @Nested
    @DisplayName("getOrCompute with L1 only")
    class LocalOnly {

        private TieredCacheStore cache;
        private final AtomicInteger calls = new AtomicInteger();

        @BeforeEach
        void setUp() {
            cache = TieredCacheStore.builder().l1Cache(l1).clock(clock).build();
        }

        @Test
        @DisplayName("a fresh entry is served without calling compute")
        void hitSkipsCompute() throws Exception {
            cache.getOrCompute("news:search", TTL, STRING, () -> "result-" + calls.incrementAndGet());
            clock.advance(Duration.ofSeconds(5));
            String second = cache.getOrCompute("news:search", TTL, STRING, () -> "result-" + calls.incrementAndGet());

            assertThat(second).isEqualTo("result-1");
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("an expired entry is recomputed")
        void expiredRecomputes() throws Exception {
            cache.getOrCompute("news:search", TTL, STRING, () -> "result-" + calls.incrementAndGet());
            clock.advance(TTL.plusSeconds(1));
            String second = cache.getOrCompute("news:search", TTL, STRING, () -> "result-" + calls.incrementAndGet());

            assertThat(second).isEqualTo("result-2");
            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("failures propagate and are never cached")
        void failureNotCached() throws Exception {
            assertThatThrownBy(() -> cache.getOrCompute("news:search", TTL, STRING, () -> {
                calls.incrementAndGet();
                throw new IOException("upstream down");
            })).isInstanceOf(IOException.class);

            String value = cache.getOrCompute("news:search", TTL, STRING, () -> "ok-" + calls.incrementAndGet());

            assertThat(value).isEqualTo("ok-2");
        }

        @Test
        @DisplayName("null results are returned but not cached")
        void nullNotCached() throws Exception {
            assertThat(cache.<String>getOrCompute("news:search", TTL, STRING, () -> null)).isNull();

            assertThat(cache.containsKey("news:search")).isFalse();
        }
    }

    @Nested
    @DisplayName("With an L2 tier")
    class WithL2 {

        private RedisCacheStore l2;
        private TieredCacheStore cache;

        @BeforeEach
        void setUp() {
            l2 = mock(RedisCacheStore.class);
            cache = TieredCacheStore.builder()
                    .l1Cache(l1)
                    .l2Cache(l2)
                    .clock(clock)
                    .l2FailureCooldown(Duration.ofSeconds(30))
                    .build();
        }

        @Test
        @DisplayName("an L2 hit backfills L1 with the original creation time")
        void l2HitBackfills() throws Exception {
            CacheEntry<String> shared = CacheEntry.of("news:search", "from-redis", TTL, clock);
            given(l2.<String>get(eq("news:search"), any(JavaType.class))).willReturn(Optional.of(shared));
            clock.advance(Duration.ofSeconds(4));

            String value = cache.getOrCompute("news:search", TTL, STRING, () -> "computed");

            assertThat(value).isEqualTo("from-redis");
            assertThat(l1.<String>get("news:search", STRING))
                    .hasValueSatisfying(e -> assertThat(e.createdAt()).isEqualTo(shared.createdAt()));
            assertThat(cache.getStats()).containsEntry("l2_hits", 1L);
        }

        @Test
        @DisplayName("writes go to both tiers")
        void writesBothTiers() throws Exception {
            given(l2.<String>get(anyString(), any(JavaType.class))).willReturn(Optional.empty());

            cache.getOrCompute("news:search", TTL, STRING, () -> "computed");

            verify(l2).put(any(CacheEntry.class));
            assertThat(l1.containsKey("news:search")).isTrue();
        }

        @Test
        @DisplayName("an L2 outage degrades to L1 and suspends L2 for the cool-down")
        void outageDegrades() throws Exception {
            given(l2.<String>get(anyString(), any(JavaType.class)))
                    .willThrow(new CacheTierUnavailableException("down", new RuntimeException()));
            willThrow(new CacheTierUnavailableException("down", new RuntimeException()))
                    .given(l2).put(any(CacheEntry.class));

            String first = cache.getOrCompute("news:a", TTL, STRING, () -> "a");
            String second = cache.getOrCompute("news:b", TTL, STRING, () -> "b");

            assertThat(first).isEqualTo("a");
            assertThat(second).isEqualTo("b");
            assertThat(cache.isL2Active()).isFalse();
            verify(l2, times(1)).get(anyString(), any(JavaType.class));
            assertThat(cache.getOrCompute("news:a", TTL, STRING, () -> "recomputed")).isEqualTo("a");

            clock.advance(Duration.ofSeconds(31));

            assertThat(cache.isL2Active()).isTrue();
        }

        @Test
        @DisplayName("clearNamespace reaches both tiers")
        void clearNamespace() {
            cache.clearNamespace("news:");

            verify(l2).clearNamespace("news:");
            verify(l2, never()).clear();
        }
    }
}
