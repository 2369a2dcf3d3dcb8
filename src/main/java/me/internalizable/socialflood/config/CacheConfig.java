package me.internalizable.socialflood.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import me.internalizable.socialflood.cache.types.LocalCacheStore;
import me.internalizable.socialflood.cache.types.RedisCacheStore;
import me.internalizable.socialflood.cache.types.TieredCacheStore;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Bean
    public LocalCacheStore responseL1Cache(
            @Value("${cache.local.max-size:1000}") int maxSize,
            Clock clock) {
        return LocalCacheStore.builder()
                .name("responses-l1")
                .maxSize(maxSize)
                .clock(clock)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "cache.redis.enabled", havingValue = "true")
    public LettuceConnectionFactory redisConnectionFactory(
            @Value("${spring.data.redis.host:localhost}") String host,
            @Value("${spring.data.redis.port:6379}") int port,
            @Value("${spring.data.redis.password:}") String password,
            @Value("${spring.data.redis.timeout:2000ms}") Duration timeout) {

        RedisStandaloneConfiguration serverConfig = new RedisStandaloneConfiguration(host, port);
        if (password != null && !password.isBlank()) {
            serverConfig.setPassword(password);
        }

        GenericObjectPoolConfig<?> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(8);
        poolConfig.setMaxIdle(8);
        poolConfig.setMinIdle(2);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setMaxWait(timeout);

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(timeout)
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .build();

        LettuceClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .poolConfig(poolConfig)
                .commandTimeout(timeout)
                .clientOptions(clientOptions)
                .build();

        logger.info("Redis connection configured - {}:{}", host, port);
        return new LettuceConnectionFactory(serverConfig, clientConfig);
    }

    // Never connected unless Redis is enabled; keeps StringRedisTemplate injectable.
    @Bean
    @ConditionalOnProperty(name = "cache.redis.enabled", havingValue = "false", matchIfMissing = true)
    public LettuceConnectionFactory noOpRedisConnectionFactory() {
        return new LettuceConnectionFactory(new RedisStandaloneConfiguration("localhost", 6379));
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public TieredCacheStore responseCache(
            LocalCacheStore responseL1Cache,
            @Value("${cache.redis.enabled:false}") boolean redisEnabled,
            @Value("${cache.redis.key-prefix:socialflood:cache}") String keyPrefix,
            @Value("${cache.redis.failure-cooldown:30s}") Duration failureCooldown,
            ObjectMapper objectMapper,
            StringRedisTemplate redisTemplate,
            Clock clock) {

        var builder = TieredCacheStore.builder()
                .l1Cache(responseL1Cache)
                .clock(clock)
                .l2FailureCooldown(failureCooldown);

        if (redisEnabled) {
            RedisCacheStore l2Cache = RedisCacheStore.builder()
                    .redisTemplate(redisTemplate)
                    .objectMapper(objectMapper)
                    .keyPrefix(keyPrefix)
                    .clock(clock)
                    .build();
            builder.l2Cache(l2Cache);
        }

        logger.info("Response cache initialized - L1 max size: {}, L2: {}",
                responseL1Cache.getMaxSize(), redisEnabled ? "redis" : "disabled");
        return builder.build();
    }
}
