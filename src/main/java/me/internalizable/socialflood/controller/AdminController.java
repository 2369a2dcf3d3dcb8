package me.internalizable.socialflood.controller;

import me.internalizable.socialflood.cache.types.TieredCacheStore;
import me.internalizable.socialflood.orchestrator.Orchestrator;
import me.internalizable.socialflood.ratelimit.RateLimitService;
import me.internalizable.socialflood.transport.PooledTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational endpoints for the cache, transport and rate limiter.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final TieredCacheStore cacheStore;
    private final Orchestrator orchestrator;
    private final PooledTransport transport;
    private final RateLimitService rateLimitService;

    public AdminController(TieredCacheStore cacheStore,
                           Orchestrator orchestrator,
                           PooledTransport transport,
                           RateLimitService rateLimitService) {
        this.cacheStore = cacheStore;
        this.orchestrator = orchestrator;
        this.transport = transport;
        this.rateLimitService = rateLimitService;
    }

    /**
     * Get cache statistics
     */
    @GetMapping("/cache/stats")
    public Map<String, Object> cacheStats() {
        return cacheStore.getStats();
    }

    /**
     * Clear all caches, or a single namespace
     */
    @PostMapping("/cache/clear")
    public Map<String, Object> clearCache(@RequestParam(required = false) String namespace) {
        if (namespace == null || namespace.isBlank()) {
            cacheStore.clear();
            logger.info("All caches cleared via admin endpoint");
            return Map.of(
                    "success", true,
                    "message", "All caches cleared"
            );
        }

        orchestrator.clearNamespace(namespace);
        return Map.of(
                "success", true,
                "message", "Cache namespace '" + namespace + "' cleared"
        );
    }

    @GetMapping("/transport/stats")
    public Map<String, Object> transportStats() {
        return transport.getStats();
    }

    @GetMapping("/rate-limit/{identity}")
    public Map<String, Object> rateLimitInfo(@PathVariable String identity) {
        RateLimitService.RateLimitInfo info = rateLimitService.getRateLimitInfo(identity);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("identity", identity);
        result.put("enabled", rateLimitService.isEnabled());
        result.put("limit", info.limit());
        result.put("remaining", info.remaining());
        result.put("windowSeconds", info.windowSeconds());
        return result;
    }

    @PostMapping("/rate-limit/{identity}/reset")
    public Map<String, Object> resetRateLimit(@PathVariable String identity) {
        rateLimitService.resetLimit(identity);
        return Map.of(
                "success", true,
                "message", "Rate limit reset for " + identity
        );
    }
}
