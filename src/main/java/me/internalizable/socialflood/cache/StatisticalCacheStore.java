package me.internalizable.socialflood.cache;

import java.util.Map;


public interface StatisticalCacheStore extends CacheStore {

    /**
     * Get cache statistics
     * @return Map of statistic name to value
     */
    Map<String, Object> getStats();

    /**
     * Get the cache hit rate
     * @return Hit rate as percentage (0-100)
     */
    double getHitRate();

    long getHitCount();

    long getMissCount();
}
