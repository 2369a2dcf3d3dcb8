package me.internalizable.socialflood.config;

import me.internalizable.socialflood.concurrency.ConcurrencyGate;
import me.internalizable.socialflood.orchestrator.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs deadline-bounded pipelines and fan-out workers. Fan-out width is capped per batch by the gate.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("orchestrator-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public ConcurrencyGate concurrencyGate(
            @Qualifier("orchestrationExecutor") ExecutorService executor,
            @Value("${gate.default-max-parallel:3}") int defaultMaxParallel) {
        return new ConcurrencyGate(executor, defaultMaxParallel);
    }
}
