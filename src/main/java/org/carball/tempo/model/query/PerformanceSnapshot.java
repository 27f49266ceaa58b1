package org.carball.tempo.model.query;

/**
 * Aggregate statistics derived from a set of samples. Recomputed on every call.
 */
public record PerformanceSnapshot(
        double averageTimeMs,
        double p95TimeMs,
        double p99TimeMs,
        long executionCount
) {

    public static final PerformanceSnapshot EMPTY = new PerformanceSnapshot(0, 0, 0, 0);
}
