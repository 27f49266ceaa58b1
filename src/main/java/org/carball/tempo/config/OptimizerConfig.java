package org.carball.tempo.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class OptimizerConfig {

    // SLA and health thresholds
    @Builder.Default
    private double slowQueryThresholdMs = 50.0;

    @Builder.Default
    private double degradedP95ThresholdMs = 35.0;

    @Builder.Default
    private double slowQueryFractionThreshold = 0.10;

    @Builder.Default
    private double lowCacheHitRatePercent = 60.0;

    // Risk classification
    @Builder.Default
    private double criticalRiskThresholdMs = 100.0;

    @Builder.Default
    private double mediumRiskThresholdMs = 25.0;

    @Builder.Default
    private int frequentExecutionThreshold = 100;

    // Cache admission
    @Builder.Default
    private double minCacheableExecutionMs = 10.0;

    @Builder.Default
    private int maxCacheableResultSize = 1000;

    @Builder.Default
    private double refreshThresholdFraction = 0.2;

    @Builder.Default
    private List<String> readOnlyMarkers = List.of("select", "count", "exists");

    // TTLs
    @Builder.Default
    private long defaultTtlMs = 300_000L;

    @Builder.Default
    private long userTtlMs = 300_000L;

    @Builder.Default
    private long staticTtlMs = 86_400_000L;

    @Builder.Default
    private long apiTtlMs = 600_000L;

    @Builder.Default
    private long contentTtlMs = 300_000L;

    @Builder.Default
    private long subscriptionTtlMs = 1_800_000L;

    // Retention and maintenance
    @Builder.Default
    private int maxSamplesPerQuery = 1000;

    @Builder.Default
    private long sampleRetentionMs = 86_400_000L;

    @Builder.Default
    private long metricsPruneIntervalMs = 3_600_000L;

    @Builder.Default
    private long cacheSweepIntervalMs = 1_800_000L;

    @Builder.Default
    private int backgroundThreads = 4;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default thresholds for a 50ms p95 SLA";

    /**
     * Creates the default configuration: 50ms p95 SLA, 1000 samples per query, 24h retention.
     */
    public static OptimizerConfig defaults() {
        return OptimizerConfig.builder().build();
    }

    /**
     * Validates the configuration and logs warnings for values that make the thresholds inconsistent.
     */
    public void validate() {
        if (slowQueryThresholdMs <= 0) {
            log.warn("Slow query threshold ({}ms) should be positive", slowQueryThresholdMs);
        }

        if (degradedP95ThresholdMs >= slowQueryThresholdMs) {
            log.warn("Degraded p95 threshold ({}ms) should be below the slow query threshold ({}ms)",
                    degradedP95ThresholdMs, slowQueryThresholdMs);
        }

        if (criticalRiskThresholdMs <= slowQueryThresholdMs) {
            log.warn("Critical risk threshold ({}ms) should be greater than the slow query threshold ({}ms)",
                    criticalRiskThresholdMs, slowQueryThresholdMs);
        }

        if (mediumRiskThresholdMs >= slowQueryThresholdMs) {
            log.warn("Medium risk threshold ({}ms) should be below the slow query threshold ({}ms)",
                    mediumRiskThresholdMs, slowQueryThresholdMs);
        }

        if (slowQueryFractionThreshold <= 0 || slowQueryFractionThreshold >= 1) {
            log.warn("Slow query fraction ({}) should be between 0 and 1", slowQueryFractionThreshold);
        }

        if (refreshThresholdFraction <= 0 || refreshThresholdFraction >= 1) {
            log.warn("Refresh threshold fraction ({}) should be between 0 and 1", refreshThresholdFraction);
        }

        if (maxSamplesPerQuery <= 0) {
            log.warn("Max samples per query ({}) should be positive", maxSamplesPerQuery);
        }

        if (backgroundThreads <= 0) {
            log.warn("Background threads ({}) should be positive", backgroundThreads);
        }

        if (readOnlyMarkers == null || readOnlyMarkers.isEmpty()) {
            log.warn("No read-only markers configured; no query results will be cached");
        }

        log.debug("Using thresholds - Slow: {}ms, Degraded: {}ms, Samples: {}, Profile: {}",
                slowQueryThresholdMs, degradedP95ThresholdMs, maxSamplesPerQuery, profileName);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Slow: %.1fms | Degraded: %.1fms | Slow fraction: %.2f | Samples/query: %d | Default TTL: %dms",
                profileName, slowQueryThresholdMs, degradedP95ThresholdMs,
                slowQueryFractionThreshold, maxSamplesPerQuery, defaultTtlMs);
    }
}
