package me.internalizable.socialflood.cache;

/**
 * Raised by a networked cache tier when its backend cannot be reached.
 * Absorbed by {@link me.internalizable.socialflood.cache.types.TieredCacheStore}; never surfaced to callers.
 */
public class CacheTierUnavailableException extends RuntimeException {

    public CacheTierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
