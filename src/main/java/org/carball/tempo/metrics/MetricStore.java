package org.carball.tempo.metrics;

import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.model.query.Percentiles;
import org.carball.tempo.model.query.PerformanceSnapshot;
import org.carball.tempo.model.query.QuerySample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process, time-bounded store of execution samples keyed by queryId.
 * <p>
 * Each queryId keeps at most {@code maxSamplesPerQuery} samples in insertion order; the oldest
 * sample is dropped when the cap is exceeded. Nothing here throws for unknown ids.
 */
@Slf4j
public class MetricStore {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int maxSamplesPerQuery;
    private final Clock clock;

    public MetricStore(int maxSamplesPerQuery, Clock clock) {
        if (maxSamplesPerQuery <= 0) {
            throw new IllegalArgumentException("maxSamplesPerQuery must be positive: " + maxSamplesPerQuery);
        }
        this.maxSamplesPerQuery = maxSamplesPerQuery;
        this.clock = clock;
    }

    public MetricStore() {
        this(1000, Clock.systemUTC());
    }

    public void record(QuerySample sample) {
        while (true) {
            Bucket bucket = buckets.computeIfAbsent(sample.queryId(), id -> new Bucket());
            if (bucket.append(sample, maxSamplesPerQuery)) {
                return;
            }
            // bucket was retired by a concurrent prune, retry with a fresh one
        }
    }

    public int prune() {
        return prune(DEFAULT_RETENTION);
    }

    /**
     * Removes samples older than the cutoff and drops buckets left empty.
     *
     * @return number of samples removed
     */
    public int prune(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;

        for (Map.Entry<String, Bucket> entry : buckets.entrySet()) {
            Bucket bucket = entry.getValue();
            removed += bucket.removeOlderThan(cutoff);
            if (bucket.retireIfEmpty()) {
                buckets.remove(entry.getKey(), bucket);
            }
        }

        if (removed > 0) {
            log.debug("Pruned {} samples older than {}", removed, cutoff);
        }
        return removed;
    }

    public List<QuerySample> samplesFor(String queryId) {
        Bucket bucket = buckets.get(queryId);
        return bucket == null ? List.of() : bucket.snapshot();
    }

    public List<QuerySample> allSamples() {
        List<QuerySample> all = new ArrayList<>();
        for (Bucket bucket : buckets.values()) {
            all.addAll(bucket.snapshot());
        }
        return all;
    }

    public Set<String> queryIds() {
        return new TreeSet<>(buckets.keySet());
    }

    public long totalSamples() {
        return buckets.values().stream().mapToLong(Bucket::size).sum();
    }

    public void clear() {
        buckets.clear();
    }

    public PerformanceSnapshot snapshot(String queryId) {
        return snapshotOf(samplesFor(queryId));
    }

    public PerformanceSnapshot globalSnapshot() {
        return snapshotOf(allSamples());
    }

    /**
     * Index-based percentiles: sort ascending and pick {@code floor(n * p)}. No interpolation.
     */
    public static Percentiles percentiles(List<QuerySample> samples) {
        if (samples.isEmpty()) {
            return Percentiles.ZERO;
        }

        double[] sorted = samples.stream()
                .mapToDouble(QuerySample::executionTimeMs)
                .sorted()
                .toArray();

        return new Percentiles(
                pick(sorted, 0.50),
                pick(sorted, 0.95),
                pick(sorted, 0.99));
    }

    public static PerformanceSnapshot snapshotOf(List<QuerySample> samples) {
        if (samples.isEmpty()) {
            return PerformanceSnapshot.EMPTY;
        }

        double average = samples.stream()
                .mapToDouble(QuerySample::executionTimeMs)
                .average()
                .orElse(0.0);
        Percentiles percentiles = percentiles(samples);

        return new PerformanceSnapshot(average, percentiles.p95(), percentiles.p99(), samples.size());
    }

    private static double pick(double[] sorted, double percentile) {
        int index = (int) Math.floor(sorted.length * percentile);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    private static final class Bucket {
        private final Deque<QuerySample> samples = new ArrayDeque<>();
        private boolean retired;

        synchronized boolean append(QuerySample sample, int cap) {
            if (retired) {
                return false;
            }
            samples.addLast(sample);
            while (samples.size() > cap) {
                samples.removeFirst();
            }
            return true;
        }

        synchronized int removeOlderThan(Instant cutoff) {
            int before = samples.size();
            samples.removeIf(s -> s.timestamp().isBefore(cutoff));
            return before - samples.size();
        }

        synchronized boolean retireIfEmpty() {
            if (samples.isEmpty()) {
                retired = true;
            }
            return retired;
        }

        synchronized List<QuerySample> snapshot() {
            return new ArrayList<>(samples);
        }

        synchronized int size() {
            return samples.size();
        }
    }
}
