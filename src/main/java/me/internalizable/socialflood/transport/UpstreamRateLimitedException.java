package me.internalizable.socialflood.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * The upstream answered 429. Never retried by the transport.
 */
public class UpstreamRateLimitedException extends TransportException {

    private final Duration retryAfter;

    public UpstreamRateLimitedException(String message, Duration retryAfter) {
        super(message, 429);
        this.retryAfter = retryAfter;
    }

    /**
     * The delay the upstream asked for, when it sent a usable {@code Retry-After} header.
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
