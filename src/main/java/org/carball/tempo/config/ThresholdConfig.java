package org.carball.tempo.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * YAML overlay for {@link OptimizerConfig}. Only keys present in the file are applied.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdConfig {

    @JsonProperty("slow_query_threshold_ms")
    private Double slowQueryThresholdMs;

    @JsonProperty("degraded_p95_threshold_ms")
    private Double degradedP95ThresholdMs;

    @JsonProperty("slow_query_fraction_threshold")
    private Double slowQueryFractionThreshold;

    @JsonProperty("low_cache_hit_rate_percent")
    private Double lowCacheHitRatePercent;

    @JsonProperty("critical_risk_threshold_ms")
    private Double criticalRiskThresholdMs;

    @JsonProperty("medium_risk_threshold_ms")
    private Double mediumRiskThresholdMs;

    @JsonProperty("frequent_execution_threshold")
    private Integer frequentExecutionThreshold;

    @JsonProperty("min_cacheable_execution_ms")
    private Double minCacheableExecutionMs;

    @JsonProperty("max_cacheable_result_size")
    private Integer maxCacheableResultSize;

    @JsonProperty("refresh_threshold_fraction")
    private Double refreshThresholdFraction;

    @JsonProperty("read_only_markers")
    private List<String> readOnlyMarkers;

    @JsonProperty("default_ttl_ms")
    private Long defaultTtlMs;

    @JsonProperty("user_ttl_ms")
    private Long userTtlMs;

    @JsonProperty("static_ttl_ms")
    private Long staticTtlMs;

    @JsonProperty("api_ttl_ms")
    private Long apiTtlMs;

    @JsonProperty("content_ttl_ms")
    private Long contentTtlMs;

    @JsonProperty("subscription_ttl_ms")
    private Long subscriptionTtlMs;

    @JsonProperty("max_samples_per_query")
    private Integer maxSamplesPerQuery;

    @JsonProperty("sample_retention_ms")
    private Long sampleRetentionMs;

    @JsonProperty("background_threads")
    private Integer backgroundThreads;

    public void applyTo(OptimizerConfig.OptimizerConfigBuilder builder) {
        if (slowQueryThresholdMs != null) builder.slowQueryThresholdMs(slowQueryThresholdMs);
        if (degradedP95ThresholdMs != null) builder.degradedP95ThresholdMs(degradedP95ThresholdMs);
        if (slowQueryFractionThreshold != null) builder.slowQueryFractionThreshold(slowQueryFractionThreshold);
        if (lowCacheHitRatePercent != null) builder.lowCacheHitRatePercent(lowCacheHitRatePercent);
        if (criticalRiskThresholdMs != null) builder.criticalRiskThresholdMs(criticalRiskThresholdMs);
        if (mediumRiskThresholdMs != null) builder.mediumRiskThresholdMs(mediumRiskThresholdMs);
        if (frequentExecutionThreshold != null) builder.frequentExecutionThreshold(frequentExecutionThreshold);
        if (minCacheableExecutionMs != null) builder.minCacheableExecutionMs(minCacheableExecutionMs);
        if (maxCacheableResultSize != null) builder.maxCacheableResultSize(maxCacheableResultSize);
        if (refreshThresholdFraction != null) builder.refreshThresholdFraction(refreshThresholdFraction);
        if (readOnlyMarkers != null) builder.readOnlyMarkers(List.copyOf(readOnlyMarkers));
        if (defaultTtlMs != null) builder.defaultTtlMs(defaultTtlMs);
        if (userTtlMs != null) builder.userTtlMs(userTtlMs);
        if (staticTtlMs != null) builder.staticTtlMs(staticTtlMs);
        if (apiTtlMs != null) builder.apiTtlMs(apiTtlMs);
        if (contentTtlMs != null) builder.contentTtlMs(contentTtlMs);
        if (subscriptionTtlMs != null) builder.subscriptionTtlMs(subscriptionTtlMs);
        if (maxSamplesPerQuery != null) builder.maxSamplesPerQuery(maxSamplesPerQuery);
        if (sampleRetentionMs != null) builder.sampleRetentionMs(sampleRetentionMs);
        if (backgroundThreads != null) builder.backgroundThreads(backgroundThreads);
    }
}
