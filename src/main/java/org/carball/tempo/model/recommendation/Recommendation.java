package org.carball.tempo.model.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Actionable advice for a single query or for the workload as a whole.
 * Serialized as-is for external dashboards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {
    private RecommendationType type;
    private Priority priority;
    private String description;
    private double estimatedImprovement;
    private ImplementationComplexity implementationComplexity;
    private String sqlExample;
}
