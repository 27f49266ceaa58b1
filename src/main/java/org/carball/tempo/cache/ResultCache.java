package org.carball.tempo.cache;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * TTL-based cache of query results with tag-based invalidation.
 * <p>
 * Caching is an optimization only: any failure of the backing {@link CacheStore} is logged and
 * treated as a miss, never propagated. Expiry is left to the store; {@link #sweepExpired()} asks it
 * to evict what has expired and drops the tag links of keys that are gone.
 * <p>
 * Every mutation of a key (write, invalidation, sweep) runs inside {@code keyTags.compute} for that
 * key, so the store write and the tag index for one key always change together.
 */
@Slf4j
public class ResultCache {

    private final CacheStore store;
    private final Clock clock;
    private final Map<String, Set<String>> tagIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> keyTags = new ConcurrentHashMap<>();

    private final LongAdder failedReads = new LongAdder();
    private final LongAdder storeFailures = new LongAdder();

    public ResultCache(CacheStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public ResultCache() {
        this(new InMemoryCacheStore(), Clock.systemUTC());
    }

    public Optional<Object> get(String key) {
        return getEntry(key).map(CacheEntry::value);
    }

    /**
     * Returns the entry for the key if it is still within its TTL.
     */
    public Optional<CacheEntry> getEntry(String key) {
        CacheEntry entry;
        try {
            entry = store.get(key);
        } catch (RuntimeException e) {
            storeFailures.increment();
            failedReads.increment();
            log.warn("Cache read failed for key={}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }

        if (entry == null || !entry.isValidAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void set(String key, Object value, long ttlMs) {
        set(key, value, ttlMs, List.of());
    }

    public void set(String key, Object value, long ttlMs, Collection<String> tags) {
        CacheEntry entry = new CacheEntry(key, value, clock.instant(), ttlMs, Set.copyOf(tags));
        boolean[] written = {false};

        keyTags.compute(key, (k, previousTags) -> {
            try {
                store.put(entry);
            } catch (RuntimeException e) {
                storeFailures.increment();
                log.warn("Cache write failed for key={}, result not cached: {}", key, e.getMessage());
                return previousTags;
            }
            if (previousTags != null) {
                unlinkTags(k, previousTags, entry.tags());
            }
            linkTags(k, entry.tags());
            written[0] = true;
            return entry.tags().isEmpty() ? null : entry.tags();
        });

        if (written[0]) {
            log.debug("Cached key={} ttl={}ms tags={}", key, ttlMs, entry.tags());
        }
    }

    /**
     * Removes every entry carrying any of the given tags. Unknown tags are ignored.
     *
     * @return number of keys removed
     */
    public int invalidateByTags(Collection<String> tags) {
        int removed = 0;

        for (String tag : tags) {
            Set<String> keys = tagIndex.get(tag);
            if (keys == null) {
                continue;
            }
            for (String key : Set.copyOf(keys)) {
                if (invalidateKey(key, tag)) {
                    removed++;
                }
            }
        }

        if (removed > 0) {
            log.info("Invalidated {} cache entries for tags {}", removed, tags);
        }
        return removed;
    }

    /**
     * Advisory sweep bounding memory; correctness never depends on it.
     *
     * @return number of expired entries removed
     */
    public int sweepExpired() {
        int removed;
        try {
            removed = store.cleanUp();
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Cache sweep aborted: {}", e.getMessage());
            return 0;
        }

        for (String key : Set.copyOf(keyTags.keySet())) {
            keyTags.computeIfPresent(key, (k, tags) -> {
                try {
                    if (store.contains(k)) {
                        return tags;
                    }
                } catch (RuntimeException e) {
                    storeFailures.increment();
                    return tags;
                }
                unlinkTags(k, tags, Set.of());
                return null;
            });
        }

        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
        return removed;
    }

    public int size() {
        try {
            return store.entries().size();
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Cache size unavailable: {}", e.getMessage());
            return 0;
        }
    }

    public CacheStatistics statistics() {
        int entries = size();
        CacheStats stats;
        try {
            stats = store.stats();
        } catch (RuntimeException e) {
            storeFailures.increment();
            log.warn("Cache statistics unavailable: {}", e.getMessage());
            stats = CacheStats.empty();
        }

        return new CacheStatistics(entries, tagIndex.size(), stats.hitCount(),
                stats.missCount() + failedReads.sum(), stats.evictionCount(), storeFailures.sum());
    }

    private boolean invalidateKey(String key, String tag) {
        boolean[] removed = {false};

        keyTags.computeIfPresent(key, (k, tags) -> {
            if (!tags.contains(tag)) {
                return tags;
            }
            try {
                removed[0] = store.remove(k);
            } catch (RuntimeException e) {
                storeFailures.increment();
                log.warn("Cache removal failed for key={}: {}", k, e.getMessage());
                return tags;
            }
            unlinkTags(k, tags, Set.of());
            return null;
        });
        return removed[0];
    }

    private void linkTags(String key, Set<String> tags) {
        for (String tag : tags) {
            tagIndex.compute(tag, (t, keys) -> {
                Set<String> linked = keys != null ? keys : ConcurrentHashMap.newKeySet();
                linked.add(key);
                return linked;
            });
        }
    }

    private void unlinkTags(String key, Set<String> oldTags, Set<String> keep) {
        for (String tag : oldTags) {
            if (keep.contains(tag)) {
                continue;
            }
            tagIndex.computeIfPresent(tag, (t, keys) -> {
                keys.remove(key);
                return keys.isEmpty() ? null : keys;
            });
        }
    }
}
