package org.carball.tempo.model.analysis;

import org.carball.tempo.model.recommendation.Recommendation;

import java.time.Instant;
import java.util.List;

public record PerformanceReport(
        Instant generatedAt,
        PerformanceSummary summary,
        List<QueryStatistics> slowestQueries,
        List<Recommendation> recommendations
) {}
