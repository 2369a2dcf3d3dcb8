package me.internalizable.socialflood.config;

import me.internalizable.socialflood.transport.PooledTransport;
import me.internalizable.socialflood.transport.TransportProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TransportProperties.class)
public class TransportConfig {

    @Bean(destroyMethod = "close")
    public PooledTransport pooledTransport(TransportProperties properties, Clock clock) {
        return new PooledTransport(properties, clock);
    }
}
