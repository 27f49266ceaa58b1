package org.carball.tempo.model.analysis;

/**
 * Per-query row of the slowest-queries table.
 */
public record QueryStatistics(
        String queryId,
        double averageTime,
        double p95Time,
        long executionCount
) {}
