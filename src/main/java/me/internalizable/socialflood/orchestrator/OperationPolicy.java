package me.internalizable.socialflood.orchestrator;

import java.time.Duration;

/**
 * Resolved per-operation limits.
 */
public record OperationPolicy(Duration ttl, Duration timeout, int maxParallel) {

    public OperationPolicy {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
    }
}
