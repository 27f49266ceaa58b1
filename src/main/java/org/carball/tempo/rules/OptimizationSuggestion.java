package org.carball.tempo.rules;

public record OptimizationSuggestion(
        String ruleId,
        String ruleName,
        String description,
        String rewrittenText,
        int estimatedImprovementPercent
) {}
