package me.internalizable.socialflood.orchestrator;

import me.internalizable.socialflood.cache.CacheKeyBuilder;
import me.internalizable.socialflood.cache.CacheParams;
import me.internalizable.socialflood.cache.types.LocalCacheStore;
import me.internalizable.socialflood.cache.types.TieredCacheStore;
import me.internalizable.socialflood.concurrency.ConcurrencyGate;
import me.internalizable.socialflood.concurrency.FetchOutcome;
import me.internalizable.socialflood.ratelimit.LocalRateLimiter;
import me.internalizable.socialflood.ratelimit.RateLimitService;
import me.internalizable.socialflood.support.MutableClock;
import me.internalizable.socialflood.transport.UpstreamRateLimitedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorTest {

    private static final Operation<String> SEARCH = Operation.of("google-news", "search", String.class)
            .withDefaultTtl(Duration.ofSeconds(10));
    private static final CacheParams PARAMS = CacheParams.builder().add("q", "ai").add("lang", "en").build();

    private MutableClock clock;
    private ExecutorService executor;
    private OrchestratorProperties properties;
    private TieredCacheStore cacheStore;
    private final AtomicInteger fetches = new AtomicInteger();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        executor = Executors.newCachedThreadPool();
        properties = new OrchestratorProperties();
        cacheStore = TieredCacheStore.builder()
                .l1Cache(LocalCacheStore.builder().maxSize(100).clock(clock).build())
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Orchestrator orchestrator(int requestsPerWindow, boolean cacheEnabled) {
        RateLimitService rateLimitService = new RateLimitService(
                new LocalRateLimiter(Duration.ofHours(1), clock), true, requestsPerWindow, Duration.ofSeconds(60));
        return new Orchestrator(
                rateLimitService,
                new CacheKeyBuilder(),
                cacheStore,
                new ConcurrencyGate(executor, 3),
                properties,
                executor,
                cacheEnabled);
    }

    private Callable<String> countingFetch() {
        return () -> "articles-" + fetches.incrementAndGet();
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("a search repeated within its 10s ttl reaches the upstream exactly once")
        void cachedWithinTtl() throws Exception {
            Orchestrator orchestrator = orchestrator(100, true);

            String first = orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());
            clock.advance(Duration.ofSeconds(5));
            String second = orchestrator.execute("bob", SEARCH, PARAMS, countingFetch());

            assertThat(first).isEqualTo("articles-1");
            assertThat(second).isEqualTo("articles-1");
            assertThat(fetches).hasValue(1);
        }

        @Test
        @DisplayName("after the ttl the upstream is called again")
        void refetchAfterTtl() throws Exception {
            Orchestrator orchestrator = orchestrator(100, true);

            orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());
            clock.advance(Duration.ofSeconds(11));
            String second = orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());

            assertThat(second).isEqualTo("articles-2");
        }

        @Test
        @DisplayName("failures are reported as UpstreamException and never cached")
        void failureNotCached() throws Exception {
            Orchestrator orchestrator = orchestrator(100, true);

            assertThatThrownBy(() -> orchestrator.execute("alice", SEARCH, PARAMS, () -> {
                fetches.incrementAndGet();
                throw new IOException("feed unavailable");
            }))
                    .isInstanceOf(UpstreamException.class)
                    .hasCauseInstanceOf(IOException.class)
                    .hasMessageContaining("google-news/search");

            assertThat(orchestrator.execute("alice", SEARCH, PARAMS, countingFetch())).isEqualTo("articles-2");
        }

        @Test
        @DisplayName("invalidate forces the next call upstream")
        void invalidate() throws Exception {
            Orchestrator orchestrator = orchestrator(100, true);

            orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());
            orchestrator.invalidate(SEARCH, PARAMS);

            assertThat(orchestrator.execute("alice", SEARCH, PARAMS, countingFetch())).isEqualTo("articles-2");
        }

        @Test
        @DisplayName("clearNamespace drops every key of that source")
        void clearNamespace() throws Exception {
            Orchestrator orchestrator = orchestrator(100, true);
            Operation<String> trends = Operation.of("google-trends", "interest", String.class);

            orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());
            orchestrator.execute("alice", trends, PARAMS, countingFetch());
            orchestrator.clearNamespace("google-news");

            assertThat(orchestrator.execute("alice", SEARCH, PARAMS, countingFetch())).isEqualTo("articles-3");
            assertThat(orchestrator.execute("alice", trends, PARAMS, countingFetch())).isEqualTo("articles-2");
        }

        @Test
        @DisplayName("with caching disabled every call goes upstream")
        void cacheDisabled() throws Exception {
            Orchestrator orchestrator = orchestrator(100, false);

            orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());
            orchestrator.execute("alice", SEARCH, PARAMS, countingFetch());

            assertThat(fetches).hasValue(2);
        }
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimiting {

        @Test
        @DisplayName("5 requests per 60s: the sixth call is refused before any cache lookup or fetch")
        void sixthCallRefused() throws Exception {
            Orchestrator orchestrator = orchestrator(5, true);
            for (int i = 0; i < 5; i++) {
                orchestrator.execute("alice", SEARCH, CacheParams.builder().add("page", i).build(), countingFetch());
            }

            assertThatThrownBy(() -> orchestrator.execute("alice", SEARCH, PARAMS, countingFetch()))
                    .isInstanceOfSatisfying(RateLimitedException.class, e -> {
                        assertThat(e.getOrigin()).isEqualTo(RateLimitedException.Origin.CALLER);
                        assertThat(e.getRetryAfter()).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(60));
                    });
            assertThat(fetches).hasValue(5);
        }

        @Test
        @DisplayName("an upstream 429 becomes RateLimitedException with the upstream's delay")
        void upstreamLimit() {
            Orchestrator orchestrator = orchestrator(100, true);

            assertThatThrownBy(() -> orchestrator.execute("alice", SEARCH, PARAMS, () -> {
                throw new UpstreamRateLimitedException("429 from news", Duration.ofSeconds(12));
            })).isInstanceOfSatisfying(RateLimitedException.class, e -> {
                assertThat(e.getOrigin()).isEqualTo(RateLimitedException.Origin.UPSTREAM);
                assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(12));
            });
        }

        @Test
        @DisplayName("an upstream 429 without Retry-After uses the configured default")
        void upstreamLimitDefault() {
            properties.setUpstreamRetryAfter(Duration.ofSeconds(90));
            Orchestrator orchestrator = orchestrator(100, true);

            assertThatThrownBy(() -> orchestrator.execute("alice", SEARCH, PARAMS, () -> {
                throw new IllegalStateException("wrapped", new UpstreamRateLimitedException("429", null));
            })).isInstanceOfSatisfying(RateLimitedException.class,
                    e -> assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(90)));
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class Deadlines {

        @Test
        @DisplayName("a fetch that outlives the timeout is interrupted and reported as a timeout")
        void timeoutCancelsFetch() {
            OrchestratorProperties.NamespaceSettings news = new OrchestratorProperties.NamespaceSettings();
            news.setTimeout(Duration.ofMillis(100));
            properties.getNamespaces().put("google-news", news);
            Orchestrator orchestrator = orchestrator(100, true);
            CountDownLatch interrupted = new CountDownLatch(1);

            assertThatThrownBy(() -> orchestrator.execute("alice", SEARCH, PARAMS, () -> {
                try {
                    Thread.sleep(5_000);
                    return "too late";
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
            })).isInstanceOfSatisfying(OrchestrationTimeoutException.class,
                    e -> assertThat(e.getTimeout()).isEqualTo(Duration.ofMillis(100)));

            assertThat(awaitQuietly(interrupted)).isTrue();
            assertThat(cacheStore.containsKey("google-news:search:lang=s:en&q=s:ai")).isFalse();
        }
    }

    @Test
    @DisplayName("fanOut applies the operation's parallelism limit")
    void fanOutUsesPolicy() throws Exception {
        OrchestratorProperties.NamespaceSettings news = new OrchestratorProperties.NamespaceSettings();
        news.setMaxParallel(2);
        properties.getNamespaces().put("google-news", news);
        Orchestrator orchestrator = orchestrator(100, true);

        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Callable<Integer>> decodes = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            int index = i;
            decodes.add(() -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(20);
                    return index;
                } finally {
                    running.decrementAndGet();
                }
            });
        }

        List<FetchOutcome<Integer>> outcomes = orchestrator.fanOut(SEARCH, decodes);

        assertThat(outcomes).extracting(FetchOutcome::value).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
