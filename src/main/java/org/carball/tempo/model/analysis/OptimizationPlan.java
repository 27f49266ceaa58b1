package org.carball.tempo.model.analysis;

import java.util.List;

public record OptimizationPlan(
        int optimizationsApplied,
        double estimatedImprovement,
        List<AppliedOptimization> details
) {}
