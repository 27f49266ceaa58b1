package org.carball.tempo.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.model.analysis.AppliedOptimization;
import org.carball.tempo.model.analysis.HealthReport;
import org.carball.tempo.model.analysis.OptimizationPlan;
import org.carball.tempo.model.analysis.PerformanceReport;
import org.carball.tempo.model.analysis.PerformanceSummary;
import org.carball.tempo.model.analysis.QueryAnalysis;
import org.carball.tempo.model.analysis.QueryStatistics;
import org.carball.tempo.model.query.PerformanceSnapshot;
import org.carball.tempo.model.recommendation.IndexSuggestion;
import org.carball.tempo.model.recommendation.Recommendation;

import java.util.List;
import java.util.Locale;

/**
 * Renders the workload report, health verdict and (optionally) one query's analysis as JSON for
 * dashboards or Markdown for humans.
 */
@Slf4j
public class PerformanceReportWriter {

    private final PerformanceReport report;
    private final HealthReport health;
    private final OptimizationPlan optimizationPlan;
    private final QueryAnalysis queryAnalysis;
    private final ObjectMapper objectMapper;

    public PerformanceReportWriter(PerformanceReport report,
                                   HealthReport health,
                                   OptimizationPlan optimizationPlan,
                                   QueryAnalysis queryAnalysis) {
        this.report = report;
        this.health = health;
        this.optimizationPlan = optimizationPlan;
        this.queryAnalysis = queryAnalysis;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(
                    new ReportData(health, report, optimizationPlan, queryAnalysis));
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        PerformanceSummary summary = report.summary();

        md.append("# Query Performance Report\n\n");
        md.append("**Generated:** ").append(report.generatedAt()).append("  \n");
        md.append("**Health:** ").append(health.status().getValue()).append("\n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Total Queries | ").append(summary.totalQueries()).append(" |\n");
        md.append("| Slow Queries | ").append(summary.slowQueries())
                .append(" (").append(format1(summary.slowQueryPercentage())).append("%) |\n");
        md.append("| Average Response Time | ").append(format2(summary.averageResponseTime())).append(" ms |\n");
        md.append("| p95 Response Time | ").append(format2(summary.p95ResponseTime())).append(" ms |\n");
        md.append("| Cache Hit Rate | ").append(format1(summary.cacheHitRate())).append("% |\n\n");

        md.append("## Slowest Queries\n\n");
        if (report.slowestQueries().isEmpty()) {
            md.append("No samples recorded.\n\n");
        } else {
            md.append("| Query | Avg (ms) | p95 (ms) | Executions |\n");
            md.append("|-------|----------|----------|------------|\n");
            for (QueryStatistics stats : report.slowestQueries()) {
                md.append("| `").append(stats.queryId()).append("` | ")
                        .append(format2(stats.averageTime())).append(" | ")
                        .append(format2(stats.p95Time())).append(" | ")
                        .append(stats.executionCount()).append(" |\n");
            }
            md.append("\n");
        }

        md.append("## Recommendations\n\n");
        appendRecommendations(md, health.recommendations());

        if (optimizationPlan != null && optimizationPlan.optimizationsApplied() > 0) {
            md.append("## Automatic Optimizations\n\n");
            md.append("Estimated mean improvement: ").append(format1(optimizationPlan.estimatedImprovement()))
                    .append("%\n\n");
            for (AppliedOptimization applied : optimizationPlan.details()) {
                md.append("- `").append(applied.queryId()).append("`: ").append(applied.optimization())
                        .append(" (").append(applied.estimatedImprovement()).append("%)\n");
            }
            md.append("\n");
        }

        if (queryAnalysis != null) {
            appendQueryAnalysis(md, queryAnalysis);
        }

        return md.toString();
    }

    private void appendQueryAnalysis(StringBuilder md, QueryAnalysis analysis) {
        PerformanceSnapshot performance = analysis.currentPerformance();

        md.append("## Query Analysis: `").append(analysis.queryId()).append("`\n\n");
        md.append("- **Risk Level:** ").append(analysis.riskLevel()).append("\n");
        md.append("- **Average:** ").append(format2(performance.averageTimeMs())).append(" ms\n");
        md.append("- **p95:** ").append(format2(performance.p95TimeMs())).append(" ms\n");
        md.append("- **p99:** ").append(format2(performance.p99TimeMs())).append(" ms\n");
        md.append("- **Executions:** ").append(performance.executionCount()).append("\n\n");

        md.append("```sql\n").append(analysis.originalQuery()).append("\n```\n\n");
        if (analysis.optimizedQuery() != null) {
            md.append("**Suggested rewrite:**\n\n");
            md.append("```sql\n").append(analysis.optimizedQuery()).append("\n```\n\n");
        }

        md.append("### Recommendations\n\n");
        appendRecommendations(md, analysis.recommendations());

        if (!analysis.indexSuggestions().isEmpty()) {
            md.append("### Index Suggestions\n\n");
            for (IndexSuggestion index : analysis.indexSuggestions()) {
                md.append("- ").append(index.getReason()).append(" (impact ").append(index.getEstimatedImpact())
                        .append("%)\n\n");
                md.append("  ```sql\n  ").append(index.getCreateStatement()).append("\n  ```\n");
            }
            md.append("\n");
        }
    }

    private static void appendRecommendations(StringBuilder md, List<Recommendation> recommendations) {
        if (recommendations.isEmpty()) {
            md.append("No recommendations.\n\n");
            return;
        }

        int number = 1;
        for (Recommendation rec : recommendations) {
            md.append(number++).append(". **").append(rec.getType()).append("** [")
                    .append(rec.getPriority()).append("] ").append(rec.getDescription())
                    .append(" (est. ").append(format1(rec.getEstimatedImprovement())).append("%, ")
                    .append(rec.getImplementationComplexity()).append(" complexity)\n");
            if (rec.getSqlExample() != null) {
                md.append("   - Example: `").append(rec.getSqlExample()).append("`\n");
            }
        }
        md.append("\n");
    }

    private static String format1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String format2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public record ReportData(
            HealthReport health,
            PerformanceReport report,
            OptimizationPlan optimizationPlan,
            QueryAnalysis queryAnalysis
    ) {}
}
