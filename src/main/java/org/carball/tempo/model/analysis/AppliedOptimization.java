package org.carball.tempo.model.analysis;

public record AppliedOptimization(
        String queryId,
        String ruleId,
        String optimization,
        int estimatedImprovement
) {}
