package org.carball.tempo.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.config.OptimizerConfig;
import org.carball.tempo.metrics.MetricStore;
import org.carball.tempo.model.analysis.AppliedOptimization;
import org.carball.tempo.model.analysis.HealthMetrics;
import org.carball.tempo.model.analysis.HealthReport;
import org.carball.tempo.model.analysis.HealthStatus;
import org.carball.tempo.model.analysis.OptimizationPlan;
import org.carball.tempo.model.analysis.PerformanceReport;
import org.carball.tempo.model.analysis.PerformanceSummary;
import org.carball.tempo.model.analysis.QueryAnalysis;
import org.carball.tempo.model.analysis.QueryStatistics;
import org.carball.tempo.model.analysis.RiskLevel;
import org.carball.tempo.model.query.PerformanceSnapshot;
import org.carball.tempo.model.query.QuerySample;
import org.carball.tempo.model.recommendation.ImplementationComplexity;
import org.carball.tempo.model.recommendation.Priority;
import org.carball.tempo.model.recommendation.Recommendation;
import org.carball.tempo.model.recommendation.RecommendationType;
import org.carball.tempo.rules.OptimizationRule;
import org.carball.tempo.rules.OptimizationRuleEngine;
import org.carball.tempo.rules.OptimizationSuggestion;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns recorded samples into per-query analyses, a workload-wide report and a health verdict.
 */
@Slf4j
public class PerformanceAnalyzer {

    private static final int SLOWEST_QUERY_LIMIT = 10;

    private static final String INDEX_EXAMPLE =
            "CREATE INDEX CONCURRENTLY idx_example ON table_name (column1, column2);";
    private static final String PAGINATION_EXAMPLE =
            "SELECT * FROM table_name WHERE conditions LIMIT 50 OFFSET 0;";

    private final MetricStore metricStore;
    private final OptimizationRuleEngine ruleEngine;
    private final IndexAdvisor indexAdvisor;
    private final OptimizerConfig config;
    private final Clock clock;

    public PerformanceAnalyzer(MetricStore metricStore,
                               OptimizationRuleEngine ruleEngine,
                               IndexAdvisor indexAdvisor,
                               OptimizerConfig config,
                               Clock clock) {
        this.metricStore = metricStore;
        this.ruleEngine = ruleEngine;
        this.indexAdvisor = indexAdvisor;
        this.config = config;
        this.clock = clock;
    }

    public QueryAnalysis analyze(String queryId) throws NoPerformanceDataException {
        List<QuerySample> samples = metricStore.samplesFor(queryId);
        if (samples.isEmpty()) {
            throw new NoPerformanceDataException(queryId);
        }

        PerformanceSnapshot performance = MetricStore.snapshotOf(samples);
        RiskLevel risk = riskLevel(performance.p95TimeMs());
        String originalQuery = samples.get(0).rawQueryText();
        Optional<OptimizationSuggestion> suggestion = ruleEngine.suggest(originalQuery);

        List<Recommendation> recommendations = new ArrayList<>();
        suggestion.ifPresent(s -> recommendations.add(Recommendation.builder()
                .type(RecommendationType.QUERY_REWRITE)
                .priority(risk.toPriority())
                .description(s.ruleName() + ": " + s.description())
                .estimatedImprovement(s.estimatedImprovementPercent())
                .implementationComplexity(ImplementationComplexity.MEDIUM)
                .sqlExample(s.rewrittenText())
                .build()));
        recommendations.addAll(queryRecommendations(originalQuery, performance));

        log.debug("Analyzed queryId={}: p95={}ms, risk={}, recommendations={}",
                queryId, performance.p95TimeMs(), risk, recommendations.size());

        return new QueryAnalysis(
                queryId,
                originalQuery,
                suggestion.map(OptimizationSuggestion::rewrittenText).orElse(null),
                performance,
                recommendations,
                indexAdvisor.suggestIndexes(originalQuery),
                risk);
    }

    public RiskLevel riskLevel(double p95Ms) {
        return RiskLevel.fromP95(p95Ms,
                config.getMediumRiskThresholdMs(),
                config.getSlowQueryThresholdMs(),
                config.getCriticalRiskThresholdMs());
    }

    public PerformanceReport globalReport() {
        List<QuerySample> all = metricStore.allSamples();
        PerformanceSummary summary = summarize(all);

        return new PerformanceReport(
                clock.instant(),
                summary,
                slowestQueries(all),
                globalRecommendations(summary));
    }

    /**
     * Never throws. Any failure while building the report is reported as an unhealthy verdict.
     */
    public HealthReport healthCheck() {
        try {
            PerformanceReport report = globalReport();
            PerformanceSummary summary = report.summary();

            HealthMetrics metrics = new HealthMetrics(
                    summary.averageResponseTime(),
                    summary.p95ResponseTime(),
                    summary.slowQueries(),
                    summary.cacheHitRate());

            return new HealthReport(healthStatus(summary), metrics, report.recommendations());
        } catch (Exception e) {
            log.error("Query performance health check failed: {}", e.getMessage(), e);
            Recommendation failure = Recommendation.builder()
                    .type(RecommendationType.QUERY_REWRITE)
                    .priority(Priority.CRITICAL)
                    .description("Query performance monitoring failed: " + e.getMessage())
                    .estimatedImprovement(0)
                    .implementationComplexity(ImplementationComplexity.HIGH)
                    .build();
            return new HealthReport(HealthStatus.UNHEALTHY, HealthMetrics.EMPTY, List.of(failure));
        }
    }

    /**
     * Picks the first matching rewrite for every query whose average exceeds the slow threshold.
     * Nothing is executed; the plan only describes what would change.
     */
    public OptimizationPlan applyAutomaticOptimizations() {
        List<AppliedOptimization> applied = new ArrayList<>();

        for (String queryId : metricStore.queryIds()) {
            List<QuerySample> samples = metricStore.samplesFor(queryId);
            if (samples.isEmpty()) {
                continue;
            }

            PerformanceSnapshot performance = MetricStore.snapshotOf(samples);
            if (performance.averageTimeMs() <= config.getSlowQueryThresholdMs()) {
                continue;
            }

            String latestQuery = samples.get(samples.size() - 1).rawQueryText();
            Optional<OptimizationRule> rule = ruleEngine.firstMatch(latestQuery);
            rule.ifPresent(r -> applied.add(new AppliedOptimization(
                    queryId, r.id(), r.name(), r.estimatedImprovementPercent())));
        }

        double meanImprovement = applied.stream()
                .mapToInt(AppliedOptimization::estimatedImprovement)
                .average()
                .orElse(0.0);

        if (!applied.isEmpty()) {
            log.info("Identified {} automatic optimizations, mean estimated improvement {}%",
                    applied.size(), String.format(Locale.ROOT, "%.1f", meanImprovement));
        }
        return new OptimizationPlan(applied.size(), meanImprovement, applied);
    }

    private HealthStatus healthStatus(PerformanceSummary summary) {
        if (summary.p95ResponseTime() > config.getSlowQueryThresholdMs()) {
            return HealthStatus.UNHEALTHY;
        }
        double slowFraction = summary.totalQueries() == 0
                ? 0.0
                : (double) summary.slowQueries() / summary.totalQueries();
        if (summary.p95ResponseTime() > config.getDegradedP95ThresholdMs()
                || slowFraction > config.getSlowQueryFractionThreshold()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    private PerformanceSummary summarize(List<QuerySample> all) {
        if (all.isEmpty()) {
            return new PerformanceSummary(0, 0, 0.0, 0.0, 0.0);
        }

        long slow = all.stream().filter(s -> s.executionTimeMs() > config.getSlowQueryThresholdMs()).count();
        long hits = all.stream().filter(QuerySample::cacheHit).count();
        PerformanceSnapshot snapshot = MetricStore.snapshotOf(all);

        return new PerformanceSummary(
                all.size(),
                slow,
                snapshot.averageTimeMs(),
                snapshot.p95TimeMs(),
                (hits * 100.0) / all.size());
    }

    private List<QueryStatistics> slowestQueries(List<QuerySample> all) {
        Map<String, List<QuerySample>> byQuery = new LinkedHashMap<>();
        for (QuerySample sample : all) {
            byQuery.computeIfAbsent(sample.queryId(), id -> new ArrayList<>()).add(sample);
        }

        return byQuery.entrySet().stream()
                .map(entry -> {
                    PerformanceSnapshot snapshot = MetricStore.snapshotOf(entry.getValue());
                    return new QueryStatistics(entry.getKey(), snapshot.averageTimeMs(),
                            snapshot.p95TimeMs(), snapshot.executionCount());
                })
                .sorted(Comparator.comparingDouble(QueryStatistics::p95Time).reversed())
                .limit(SLOWEST_QUERY_LIMIT)
                .toList();
    }

    private List<Recommendation> queryRecommendations(String query, PerformanceSnapshot performance) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (performance.p95TimeMs() > config.getSlowQueryThresholdMs()) {
            recommendations.add(Recommendation.builder()
                    .type(RecommendationType.INDEX)
                    .priority(Priority.HIGH)
                    .description("Add database indexes to improve query performance")
                    .estimatedImprovement(60)
                    .implementationComplexity(ImplementationComplexity.MEDIUM)
                    .sqlExample(INDEX_EXAMPLE)
                    .build());
        }

        if (performance.executionCount() > config.getFrequentExecutionThreshold()) {
            recommendations.add(Recommendation.builder()
                    .type(RecommendationType.CACHING)
                    .priority(Priority.MEDIUM)
                    .description("Implement query result caching for frequently executed queries")
                    .estimatedImprovement(80)
                    .implementationComplexity(ImplementationComplexity.LOW)
                    .build());
        }

        String lower = query.toLowerCase(Locale.ROOT);
        if (lower.contains("select") && !lower.contains("limit")) {
            recommendations.add(Recommendation.builder()
                    .type(RecommendationType.PAGINATION)
                    .priority(Priority.HIGH)
                    .description("Add pagination to limit result set size")
                    .estimatedImprovement(70)
                    .implementationComplexity(ImplementationComplexity.LOW)
                    .sqlExample(PAGINATION_EXAMPLE)
                    .build());
        }

        return recommendations;
    }

    private List<Recommendation> globalRecommendations(PerformanceSummary summary) {
        List<Recommendation> recommendations = new ArrayList<>();
        if (summary.totalQueries() == 0) {
            return recommendations;
        }

        if (summary.p95ResponseTime() > config.getSlowQueryThresholdMs()) {
            recommendations.add(Recommendation.builder()
                    .type(RecommendationType.INDEX)
                    .priority(Priority.CRITICAL)
                    .description(String.format(Locale.ROOT,
                            "95th percentile response time (%.2fms) exceeds requirement (%sms)",
                            summary.p95ResponseTime(), formatThreshold(config.getSlowQueryThresholdMs())))
                    .estimatedImprovement(50)
                    .implementationComplexity(ImplementationComplexity.HIGH)
                    .build());
        }

        if (summary.cacheHitRate() < config.getLowCacheHitRatePercent()) {
            recommendations.add(Recommendation.builder()
                    .type(RecommendationType.CACHING)
                    .priority(Priority.HIGH)
                    .description(String.format(Locale.ROOT,
                            "Low cache hit rate (%.1f%%) - implement more aggressive caching", summary.cacheHitRate()))
                    .estimatedImprovement(40)
                    .implementationComplexity(ImplementationComplexity.MEDIUM)
                    .build());
        }

        double slowPercentage = summary.slowQueryPercentage();
        if (slowPercentage > config.getSlowQueryFractionThreshold() * 100) {
            recommendations.add(Recommendation.builder()
                    .type(RecommendationType.QUERY_REWRITE)
                    .priority(Priority.HIGH)
                    .description(String.format(Locale.ROOT,
                            "%.1f%% of queries are slow - review and optimize query patterns", slowPercentage))
                    .estimatedImprovement(60)
                    .implementationComplexity(ImplementationComplexity.HIGH)
                    .build());
        }

        return recommendations;
    }

    private static String formatThreshold(double ms) {
        return ms == Math.rint(ms) ? String.valueOf((long) ms) : String.valueOf(ms);
    }
}
