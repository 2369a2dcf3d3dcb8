package me.internalizable.socialflood;

import me.internalizable.socialflood.cache.types.TieredCacheStore;
import me.internalizable.socialflood.orchestrator.Operation;
import me.internalizable.socialflood.orchestrator.Orchestrator;
import me.internalizable.socialflood.ratelimit.LocalRateLimiter;
import me.internalizable.socialflood.ratelimit.RateLimiter;
import me.internalizable.socialflood.transport.PooledTransport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "cache.redis.enabled=false",
        "rate-limit.use-redis=false"
})
class SocialFloodApplicationTests {

    @Autowired
    private Orchestrator orchestrator;

    @Autowired
    private TieredCacheStore cacheStore;

    @Autowired
    private PooledTransport transport;

    @Autowired
    private RateLimiter rateLimiter;

    @Test
    @DisplayName("context wires the orchestration stack from application.properties")
    void contextLoads() throws Exception {
        assertThat(cacheStore.isL2Active()).isFalse();
        assertThat(rateLimiter).isInstanceOf(LocalRateLimiter.class);
        assertThat(transport.hasProfile("default")).isTrue();
        assertThat(transport.hasProfile("google-news")).isTrue();

        Operation<String> decode = Operation.of("google-news", "decode", String.class);
        assertThat(orchestrator.policyFor(decode).ttl()).isEqualTo(Duration.ofHours(24));
        assertThat(orchestrator.policyFor(decode).maxParallel()).isEqualTo(5);

        assertThat(orchestrator.execute("smoke-test", decode, null, () -> "ok")).isEqualTo("ok");
    }
}
