package org.carball.tempo.executor;

import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.cache.CacheEntry;
import org.carball.tempo.cache.CacheTtlPolicy;
import org.carball.tempo.cache.ResultCache;
import org.carball.tempo.config.OptimizerConfig;
import org.carball.tempo.metrics.MetricStore;
import org.carball.tempo.model.query.QuerySample;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry point for running database work with caching, latency recording and slow-query
 * detection.
 * <p>
 * Concurrent misses for the same key are not deduplicated. The executor never retries and never
 * imposes a timeout; failures of the work are logged and rethrown unchanged.
 * <p>
 * A cached value is shared by every caller that hits it. List, set and map results are cached as
 * read-only copies, so callers should declare them by interface ({@code List}, {@code Set},
 * {@code Map}); any other result type must be immutable.
 */
@Slf4j
public class QueryExecutor {

    private static final String CACHE_KEY_PREFIX = "query_cache:";

    private final MetricStore metricStore;
    private final ResultCache resultCache;
    private final CacheTtlPolicy ttlPolicy;
    private final BackgroundTasks backgroundTasks;
    private final OptimizerConfig config;
    private final Clock clock;
    private final Set<String> refreshing = ConcurrentHashMap.newKeySet();

    public QueryExecutor(MetricStore metricStore,
                         ResultCache resultCache,
                         BackgroundTasks backgroundTasks,
                         OptimizerConfig config,
                         Clock clock) {
        this.metricStore = metricStore;
        this.resultCache = resultCache;
        this.ttlPolicy = new CacheTtlPolicy(config);
        this.backgroundTasks = backgroundTasks;
        this.config = config;
        this.clock = clock;
    }

    public <T> T run(String queryId, String rawQueryText, QueryWork<T> work) throws Exception {
        return run(queryId, rawQueryText, work, QueryOptions.DEFAULTS);
    }

    @SuppressWarnings("unchecked")
    public <T> T run(String queryId, String rawQueryText, QueryWork<T> work, QueryOptions options) throws Exception {
        long start = System.nanoTime();
        String queryText = rawQueryText != null ? rawQueryText : queryId;
        String cacheKey = cacheKey(queryId, queryText);

        Optional<CacheEntry> cached = resultCache.getEntry(cacheKey);
        if (cached.isPresent()) {
            CacheEntry entry = cached.get();
            double overheadMs = elapsedMs(start);
            metricStore.record(QuerySample.hit(queryId, queryText, overheadMs, clock.instant()));

            if (shouldRefreshInBackground(entry)) {
                scheduleRefresh(queryId, cacheKey, work, options);
            }
            log.debug("Cache hit: queryId={}, key={}, overhead={}ms", queryId, cacheKey, overheadMs);
            return (T) entry.value();
        }

        T result;
        try {
            result = work.execute();
        } catch (Exception e) {
            double executionTime = elapsedMs(start);
            log.error("Query execution failed: queryId={}, executionTime={}ms, error={}",
                    queryId, format(executionTime), e.getMessage());
            throw e;
        }

        double executionTime = elapsedMs(start);
        metricStore.record(QuerySample.miss(queryId, queryText, executionTime, clock.instant(),
                resultCount(result)));

        if (isCacheable(queryId, result, executionTime)) {
            resultCache.set(cacheKey, ResultShape.readOnlyCopy(result),
                    ttlPolicy.ttlFor(queryId, options.getTtlMs()), options.getTags());
        }

        if (executionTime > config.getSlowQueryThresholdMs()) {
            log.warn("Slow query detected: queryId={}, executionTime={}ms, threshold={}ms, query={}",
                    queryId, format(executionTime), format(config.getSlowQueryThresholdMs()), queryText);
        }

        return result;
    }

    /**
     * Populates the cache in the background regardless of execution time.
     */
    public CompletableFuture<Void> warm(String queryId, String rawQueryText, QueryWork<?> work, QueryOptions options) {
        String queryText = rawQueryText != null ? rawQueryText : queryId;
        String cacheKey = cacheKey(queryId, queryText);

        return backgroundTasks.submit("warm " + queryId, () -> {
            Object result = work.execute();
            if (result != null) {
                resultCache.set(cacheKey, ResultShape.readOnlyCopy(result),
                        ttlPolicy.ttlFor(queryId, options.getTtlMs()), options.getTags());
                log.debug("Warmed cache: queryId={}, key={}", queryId, cacheKey);
            }
            return null;
        });
    }

    public int invalidate(Collection<String> tags) {
        return resultCache.invalidateByTags(tags);
    }

    /**
     * True when less than the configured fraction (20% by default) of the entry's TTL remains.
     */
    boolean shouldRefreshInBackground(CacheEntry entry) {
        long remaining = entry.remainingMs(clock.instant());
        return remaining < entry.ttlMs() * config.getRefreshThresholdFraction();
    }

    boolean isCacheable(String queryId, Object result, double executionTimeMs) {
        if (result == null) return false;
        if (executionTimeMs < config.getMinCacheableExecutionMs()) return false;
        if (ResultShape.sizeOf(result) > config.getMaxCacheableResultSize()) return false;

        String id = queryId.toLowerCase(Locale.ROOT);
        return config.getReadOnlyMarkers().stream()
                .anyMatch(marker -> id.contains(marker.toLowerCase(Locale.ROOT)));
    }

    public static String cacheKey(String queryId, String rawQueryText) {
        return CACHE_KEY_PREFIX + queryId + ":" + shortHash(rawQueryText);
    }

    /**
     * At most one refresh per key is in flight. The key is released inside the task, before its
     * future completes, whether the work succeeds or throws.
     */
    private void scheduleRefresh(String queryId, String cacheKey, QueryWork<?> work, QueryOptions options) {
        if (backgroundTasks.isClosed() || !refreshing.add(cacheKey)) {
            return;
        }

        log.debug("Scheduling background refresh: queryId={}, key={}", queryId, cacheKey);
        backgroundTasks.submit("refresh " + queryId, () -> {
            try {
                Object result = work.execute();
                if (result != null) {
                    resultCache.set(cacheKey, ResultShape.readOnlyCopy(result),
                            ttlPolicy.ttlFor(queryId, options.getTtlMs()), options.getTags());
                }
                return null;
            } finally {
                refreshing.remove(cacheKey);
            }
        });
    }

    boolean isRefreshing(String cacheKey) {
        return refreshing.contains(cacheKey);
    }

    private static Long resultCount(Object result) {
        return result == null ? null : ResultShape.sizeOf(result);
    }

    private static String shortHash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String format(double ms) {
        return String.format(Locale.ROOT, "%.2f", ms);
    }
}
