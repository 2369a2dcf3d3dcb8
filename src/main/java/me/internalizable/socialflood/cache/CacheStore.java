package me.internalizable.socialflood.cache;

import com.fasterxml.jackson.databind.JavaType;

import java.util.Optional;

/**
 * Key/value store for cached upstream responses.
 * Local and networked implementations share this contract so they can be tiered.
 */
public interface CacheStore {

    /**
     * Returns the live entry for a key. Expired entries are reported as absent.
     *
     * @param valueType type used to rebuild the value when the store holds serialized data
     */
    <V> Optional<CacheEntry<V>> get(String key, JavaType valueType);

    void put(CacheEntry<?> entry);

    void evict(String key);

    void clear();

    /**
     * Removes every entry whose key starts with the given namespace prefix.
     */
    void clearNamespace(String namespacePrefix);

    boolean containsKey(String key);

    long size();
}
