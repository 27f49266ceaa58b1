package org.carball.tempo.model.analysis;

import org.carball.tempo.model.query.PerformanceSnapshot;
import org.carball.tempo.model.recommendation.IndexSuggestion;
import org.carball.tempo.model.recommendation.Recommendation;

import java.util.List;

public record QueryAnalysis(
        String queryId,
        String originalQuery,
        String optimizedQuery,
        PerformanceSnapshot currentPerformance,
        List<Recommendation> recommendations,
        List<IndexSuggestion> indexSuggestions,
        RiskLevel riskLevel
) {}
