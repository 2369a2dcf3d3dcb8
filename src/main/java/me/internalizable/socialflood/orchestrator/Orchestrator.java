package me.internalizable.socialflood.orchestrator;

import me.internalizable.socialflood.cache.CacheKeyBuilder;
import me.internalizable.socialflood.cache.CacheParams;
import me.internalizable.socialflood.cache.types.TieredCacheStore;
import me.internalizable.socialflood.concurrency.ConcurrencyGate;
import me.internalizable.socialflood.concurrency.FetchOutcome;
import me.internalizable.socialflood.ratelimit.RateLimitDecision;
import me.internalizable.socialflood.ratelimit.RateLimitService;
import me.internalizable.socialflood.transport.UpstreamRateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cache-aside pipeline in front of every upstream call:
 * rate limit check, cache key, get-or-compute, all bounded by the operation's deadline.
 *
 * Endpoint handlers supply the fetch function; it may fan out through {@link #fanOut} and
 * use the pooled transport. When the deadline passes the pipeline thread is interrupted,
 * which aborts in-flight transport requests and fan-out batches.
 */
@Service
public class Orchestrator {

    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

    private final RateLimitService rateLimitService;
    private final CacheKeyBuilder keyBuilder;
    private final TieredCacheStore cacheStore;
    private final ConcurrencyGate gate;
    private final OrchestratorProperties properties;
    private final ExecutorService executor;
    private final boolean cacheEnabled;

    public Orchestrator(
            RateLimitService rateLimitService,
            CacheKeyBuilder keyBuilder,
            TieredCacheStore cacheStore,
            ConcurrencyGate gate,
            OrchestratorProperties properties,
            @Qualifier("orchestrationExecutor") ExecutorService executor,
            @Value("${cache.enabled:true}") boolean cacheEnabled) {
        this.rateLimitService = rateLimitService;
        this.keyBuilder = keyBuilder;
        this.cacheStore = cacheStore;
        this.gate = gate;
        this.properties = properties;
        this.executor = executor;
        this.cacheEnabled = cacheEnabled;

        if (!cacheEnabled) {
            logger.warn("Response caching is disabled (cache.enabled=false), every call goes upstream");
        }
    }

    /**
     * Runs {@code fetch} for {@code identity} unless a fresh cached result exists.
     *
     * @param identity caller identity for rate limiting; blank means anonymous
     * @throws RateLimitedException           caller over its limit, or upstream answered 429
     * @throws OrchestrationTimeoutException  the operation's deadline passed
     * @throws UpstreamException              the fetch failed for any other reason
     */
    public <V> V execute(String identity, Operation<V> operation, CacheParams params, Callable<V> fetch)
            throws OrchestrationException {

        RateLimitDecision decision = rateLimitService.checkAndIncrement(identity);
        if (!decision.allowed()) {
            throw new RateLimitedException(decision.retryAfter(), RateLimitedException.Origin.CALLER);
        }

        OperationPolicy policy = policyFor(operation);
        String key = keyBuilder.build(operation.namespace(), operation.name(), params);

        Callable<V> pipeline = cacheEnabled
                ? () -> cacheStore.getOrCompute(key, policy.ttl(), operation.valueType(), fetch)
                : fetch;

        Future<V> future = executor.submit(pipeline);
        try {
            return future.get(policy.timeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("{} timed out after {}ms (key: {})", operation.qualifiedName(), policy.timeout().toMillis(), key);
            throw new OrchestrationTimeoutException(operation.qualifiedName(), policy.timeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamException(operation.qualifiedName(), e);
        } catch (ExecutionException e) {
            throw translate(operation, e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Runs a batch of sub-requests with the operation's parallelism limit.
     */
    public <T> List<FetchOutcome<T>> fanOut(Operation<?> operation, List<? extends Callable<T>> tasks)
            throws InterruptedException {
        return gate.runAll(tasks, policyFor(operation).maxParallel());
    }

    public void invalidate(Operation<?> operation, CacheParams params) {
        String key = keyBuilder.build(operation.namespace(), operation.name(), params);
        cacheStore.evict(key);
        logger.debug("Invalidated cache key: {}", key);
    }

    public void clearNamespace(String namespace) {
        cacheStore.clearNamespace(keyBuilder.namespacePrefix(namespace));
        logger.info("Cleared cache namespace: {}", namespace);
    }

    public OperationPolicy policyFor(Operation<?> operation) {
        return properties.policyFor(operation);
    }

    private OrchestrationException translate(Operation<?> operation, Throwable error) {
        if (error instanceof OrchestrationException orchestrationException) {
            return orchestrationException;
        }

        UpstreamRateLimitedException upstreamLimit = findUpstreamLimit(error);
        if (upstreamLimit != null) {
            Duration retryAfter = upstreamLimit.getRetryAfter().orElse(properties.getUpstreamRetryAfter());
            logger.warn("{} rate limited by upstream, retry after {}s", operation.qualifiedName(), retryAfter.toSeconds());
            return new RateLimitedException(retryAfter, RateLimitedException.Origin.UPSTREAM, upstreamLimit);
        }

        logger.error("{} failed: {}", operation.qualifiedName(), error.toString());
        return new UpstreamException(operation.qualifiedName(), error);
    }

    private static UpstreamRateLimitedException findUpstreamLimit(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof UpstreamRateLimitedException limited) {
                return limited;
            }
            current = current.getCause();
        }
        return null;
    }
}
