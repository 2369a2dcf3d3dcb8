package me.internalizable.socialflood.orchestrator;

import java.time.Duration;

/**
 * A call refused because a rate limit was reached, either the caller's own or the upstream's.
 */
public class RateLimitedException extends OrchestrationException {

    public enum Origin {
        CALLER,
        UPSTREAM
    }

    private final Duration retryAfter;
    private final Origin origin;

    public RateLimitedException(Duration retryAfter, Origin origin) {
        this(retryAfter, origin, null);
    }

    public RateLimitedException(Duration retryAfter, Origin origin, Throwable cause) {
        super(origin == Origin.CALLER
                ? "Rate limit exceeded. Try again in " + retryAfter.toSeconds() + " seconds."
                : "Upstream rate limit reached. Try again in " + retryAfter.toSeconds() + " seconds.", cause);
        this.retryAfter = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        this.origin = origin;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * Seconds to wait, rounded up so a client never retries early.
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.toSeconds();
        return retryAfter.toNanosPart() > 0 ? seconds + 1 : seconds;
    }
}
