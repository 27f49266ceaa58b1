package org.carball.tempo.rules;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Heuristic text rule: a predicate over raw query text and a best-effort pure rewrite.
 */
public record OptimizationRule(
        String id,
        String name,
        String description,
        Predicate<String> matcher,
        UnaryOperator<String> rewrite,
        int estimatedImprovementPercent
) {

    public OptimizationRule {
        if (estimatedImprovementPercent <= 0 || estimatedImprovementPercent > 100) {
            throw new IllegalArgumentException("estimatedImprovementPercent must be in (0,100]: "
                    + estimatedImprovementPercent);
        }
    }

    public boolean matches(String rawQueryText) {
        return matcher.test(rawQueryText);
    }

    public String apply(String rawQueryText) {
        return rewrite.apply(rawQueryText);
    }
}
