package org.carball.tempo.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed store. Each entry expires after its own TTL, measured against the supplied
 * clock so expiry follows whatever time source the rest of the optimizer uses.
 */
@Slf4j
public class InMemoryCacheStore implements CacheStore {

    private final Cache<String, CacheEntry> cache;
    private final LongAdder expirations = new LongAdder();

    public InMemoryCacheStore(Clock clock) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryTtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .evictionListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expirations.increment();
                    }
                })
                .recordStats()
                .build();
    }

    public InMemoryCacheStore() {
        this(Clock.systemUTC());
    }

    @Override
    public CacheEntry get(String key) {
        return cache.getIfPresent(key);
    }

    @Override
    public void put(CacheEntry entry) {
        cache.put(entry.key(), entry);
    }

    @Override
    public boolean remove(String key) {
        return cache.asMap().remove(key) != null;
    }

    @Override
    public boolean contains(String key) {
        return cache.asMap().containsKey(key);
    }

    @Override
    public Collection<CacheEntry> entries() {
        return new ArrayList<>(cache.asMap().values());
    }

    @Override
    public int cleanUp() {
        long before = expirations.sum();
        cache.cleanUp();
        int evicted = (int) (expirations.sum() - before);
        log.trace("Cache cleanup evicted {} expired entries", evicted);
        return evicted;
    }

    @Override
    public CacheStats stats() {
        return cache.stats();
    }

    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0L, entry.ttlMs()));
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return TimeUnit.MILLISECONDS.toNanos(Math.max(0L, entry.ttlMs()));
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
