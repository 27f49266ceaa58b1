package org.carball.tempo.model.analysis;

public record HealthMetrics(
        double averageResponseTime,
        double p95ResponseTime,
        long slowQueryCount,
        double cacheHitRate
) {

    public static final HealthMetrics EMPTY = new HealthMetrics(0, 0, 0, 0);
}
