package org.carball.tempo.config;

import lombok.Getter;

@Getter
public enum PerformanceProfile {

    DEFAULT("default", "Default thresholds for a 50ms p95 SLA", 1.0, 1.0),

    STRICT("strict", "Tighter alerting and shorter cache lifetimes for latency-sensitive services", 0.8, 0.5) {
        @Override
        public OptimizerConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .slowQueryFractionThreshold(0.05)
                    .lowCacheHitRatePercent(70.0)
                    .build();
        }
    },

    RELAXED("relaxed", "Looser alerting and longer cache lifetimes for batch and reporting workloads", 2.0, 2.0) {
        @Override
        public OptimizerConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .slowQueryFractionThreshold(0.20)
                    .lowCacheHitRatePercent(40.0)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double latencyMultiplier;
    private final double ttlMultiplier;

    PerformanceProfile(String name, String description, double latencyMultiplier, double ttlMultiplier) {
        this.name = name;
        this.description = description;
        this.latencyMultiplier = latencyMultiplier;
        this.ttlMultiplier = ttlMultiplier;
    }

    /**
     * Creates an OptimizerConfig by scaling the default latency thresholds and TTLs.
     */
    public OptimizerConfig buildConfig() {
        OptimizerConfig base = OptimizerConfig.defaults();

        return base.toBuilder()
                .profileName(name)
                .profileDescription(description)
                .slowQueryThresholdMs(base.getSlowQueryThresholdMs() * latencyMultiplier)
                .degradedP95ThresholdMs(base.getDegradedP95ThresholdMs() * latencyMultiplier)
                .criticalRiskThresholdMs(base.getCriticalRiskThresholdMs() * latencyMultiplier)
                .mediumRiskThresholdMs(base.getMediumRiskThresholdMs() * latencyMultiplier)
                .minCacheableExecutionMs(base.getMinCacheableExecutionMs() * latencyMultiplier)
                .defaultTtlMs((long) (base.getDefaultTtlMs() * ttlMultiplier))
                .userTtlMs((long) (base.getUserTtlMs() * ttlMultiplier))
                .staticTtlMs((long) (base.getStaticTtlMs() * ttlMultiplier))
                .apiTtlMs((long) (base.getApiTtlMs() * ttlMultiplier))
                .contentTtlMs((long) (base.getContentTtlMs() * ttlMultiplier))
                .subscriptionTtlMs((long) (base.getSubscriptionTtlMs() * ttlMultiplier))
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static PerformanceProfile fromName(String name) {
        for (PerformanceProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown performance profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (PerformanceProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }
}
