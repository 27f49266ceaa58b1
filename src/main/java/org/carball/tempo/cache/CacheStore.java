package org.carball.tempo.cache;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Collection;

/**
 * Backing storage for {@link ResultCache}. Implementations may be remote and may fail with
 * unchecked exceptions; the cache treats every failure as a miss.
 * <p>
 * A store expires entries itself once {@link CacheEntry#ttlMs()} has elapsed.
 */
public interface CacheStore {

    CacheEntry get(String key);

    void put(CacheEntry entry);

    /**
     * @return true if a live entry was removed
     */
    boolean remove(String key);

    boolean contains(String key);

    /**
     * Live entries only.
     */
    Collection<CacheEntry> entries();

    /**
     * Performs pending expiry work.
     *
     * @return number of expired entries evicted by this call
     */
    int cleanUp();

    CacheStats stats();
}
