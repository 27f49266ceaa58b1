package org.carball.tempo.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.tempo.analyzer.IndexAdvisor;
import org.carball.tempo.analyzer.NoPerformanceDataException;
import org.carball.tempo.analyzer.PerformanceAnalyzer;
import org.carball.tempo.config.OptimizerConfig;
import org.carball.tempo.metrics.MetricStore;
import org.carball.tempo.model.query.QuerySample;
import org.carball.tempo.rules.OptimizationRuleEngine;
import org.carball.tempo.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PerformanceReportWriterTest {

    private static final String QUERY = "SELECT * FROM content WHERE artistId = 7";

    private PerformanceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        MetricStore store = new MetricStore(1000, clock);
        analyzer = new PerformanceAnalyzer(store, new OptimizationRuleEngine(), new IndexAdvisor(),
                OptimizerConfig.defaults(), clock);

        for (int i = 0; i < 10; i++) {
            store.record(QuerySample.miss("select_artist_content", QUERY, 75, clock.instant(), 20L));
        }
    }

    @Test
    void shouldRenderJsonWithLowerCaseHealthStatus() throws Exception {
        // Given
        PerformanceReportWriter writer = new PerformanceReportWriter(
                analyzer.globalReport(), analyzer.healthCheck(), analyzer.applyAutomaticOptimizations(), null);

        // When
        JsonNode json = new ObjectMapper().readTree(writer.toJson());

        // Then
        assertThat(json.path("health").path("status").asText()).isEqualTo("unhealthy");
        assertThat(json.path("report").path("generatedAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(json.path("report").path("summary").path("totalQueries").asInt()).isEqualTo(10);
        assertThat(json.path("report").path("slowestQueries").get(0).path("queryId").asText())
                .isEqualTo("select_artist_content");
        assertThat(json.path("optimizationPlan").path("optimizationsApplied").asInt()).isEqualTo(1);
        assertThat(json.has("queryAnalysis")).isFalse();
    }

    @Test
    void shouldOmitNullFieldsInRecommendations() throws Exception {
        // Given
        PerformanceReportWriter writer = new PerformanceReportWriter(
                analyzer.globalReport(), analyzer.healthCheck(), null, null);

        // When
        JsonNode recommendations = new ObjectMapper().readTree(writer.toJson()).path("health").path("recommendations");

        // Then
        assertThat(recommendations.isArray()).isTrue();
        assertThat(recommendations.get(0).path("type").asText()).isEqualTo("INDEX");
        assertThat(recommendations.get(0).has("sqlExample")).isFalse();
    }

    @Test
    void shouldRenderMarkdownWithQueryAnalysis() throws NoPerformanceDataException {
        // Given
        PerformanceReportWriter writer = new PerformanceReportWriter(
                analyzer.globalReport(), analyzer.healthCheck(), analyzer.applyAutomaticOptimizations(),
                analyzer.analyze("select_artist_content"));

        // When
        String markdown = writer.toMarkdown();

        // Then
        assertThat(markdown)
                .startsWith("# Query Performance Report")
                .contains("**Health:** unhealthy")
                .contains("| Total Queries | 10 |")
                .contains("| `select_artist_content` | 75.00 | 75.00 | 10 |")
                .contains("## Automatic Optimizations")
                .contains("## Query Analysis: `select_artist_content`")
                .contains("- **Risk Level:** HIGH")
                .contains(QUERY + " LIMIT 1000")
                .contains("CREATE INDEX CONCURRENTLY idx_content_artistid ON content (artistId);");
    }

    @Test
    void shouldRenderMarkdownForEmptyWorkload() {
        // Given
        PerformanceAnalyzer empty = new PerformanceAnalyzer(new MetricStore(10, new MutableClock()),
                new OptimizationRuleEngine(), new IndexAdvisor(), OptimizerConfig.defaults(), new MutableClock());
        PerformanceReportWriter writer = new PerformanceReportWriter(
                empty.globalReport(), empty.healthCheck(), empty.applyAutomaticOptimizations(), null);

        // When
        String markdown = writer.toMarkdown();

        // Then
        assertThat(markdown)
                .contains("**Health:** healthy")
                .contains("No samples recorded.")
                .contains("No recommendations.")
                .doesNotContain("NaN");
    }
}
