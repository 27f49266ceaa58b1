package org.carball.tempo.model.analysis;

import org.carball.tempo.model.recommendation.Recommendation;

import java.util.List;

/**
 * Structured response for an uptime check. Always produced, even when analysis fails.
 */
public record HealthReport(
        HealthStatus status,
        HealthMetrics metrics,
        List<Recommendation> recommendations
) {}
