package org.carball.tempo.model.analysis;

public record PerformanceSummary(
        long totalQueries,
        long slowQueries,
        double averageResponseTime,
        double p95ResponseTime,
        double cacheHitRate
) {

    public double slowQueryPercentage() {
        return totalQueries == 0 ? 0.0 : (slowQueries * 100.0) / totalQueries;
    }
}
