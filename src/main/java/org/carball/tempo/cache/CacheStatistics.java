package org.carball.tempo.cache;

/**
 * Point-in-time view of the cache. Hits, misses and evictions come from the store's own
 * statistics; misses also include reads that failed in the store.
 */
public record CacheStatistics(
        int entries,
        int tags,
        long hits,
        long misses,
        long evictions,
        long storeFailures
) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (hits * 100.0) / total;
    }
}
