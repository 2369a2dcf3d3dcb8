package me.internalizable.socialflood.orchestrator;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Orchestration defaults and per-namespace / per-operation overrides.
 *
 * <pre>
 * orchestrator.default-ttl=1h
 * orchestrator.namespaces.google-news.ttl=30m
 * orchestrator.namespaces.google-news.operations.search.timeout=15s
 * </pre>
 *
 * The most specific setting wins: operation, then namespace, then the operation's in-code
 * default TTL, then the global default.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private Duration defaultTtl = Duration.ofHours(1);
    private Duration defaultTimeout = Duration.ofSeconds(30);
    private int defaultMaxParallel = 3;

    /** Used when an upstream answers 429 without a usable Retry-After header. */
    private Duration upstreamRetryAfter = Duration.ofSeconds(60);

    private Map<String, NamespaceSettings> namespaces = new LinkedHashMap<>();

    public OperationPolicy policyFor(Operation<?> operation) {
        NamespaceSettings namespace = namespaces.get(operation.namespace());
        OperationSettings op = namespace != null ? namespace.getOperations().get(operation.name()) : null;

        Duration ttl = firstNonNull(
                op != null ? op.getTtl() : null,
                namespace != null ? namespace.getTtl() : null,
                operation.defaultTtl(),
                defaultTtl);
        Duration timeout = firstNonNull(
                op != null ? op.getTimeout() : null,
                namespace != null ? namespace.getTimeout() : null,
                defaultTimeout);
        Integer maxParallel = firstNonNull(
                op != null ? op.getMaxParallel() : null,
                namespace != null ? namespace.getMaxParallel() : null,
                defaultMaxParallel);

        return new OperationPolicy(ttl, timeout, maxParallel);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... candidates) {
        for (T candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    @Getter
    @Setter
    public static class OperationSettings {
        private Duration ttl;
        private Duration timeout;
        private Integer maxParallel;
    }

    @Getter
    @Setter
    public static class NamespaceSettings extends OperationSettings {
        private Map<String, OperationSettings> operations = new LinkedHashMap<>();
    }
}
