package org.carball.tempo.cli;

import org.carball.tempo.config.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TempoCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path healthySamples;
    private Path slowSamples;

    @BeforeEach
    void setUp() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();

        healthySamples = tempDir.resolve("healthy.json");
        Files.writeString(healthySamples, samples("select_user_profile", "SELECT * FROM users WHERE id = 1 LIMIT 1", 5.0));

        slowSamples = tempDir.resolve("slow.json");
        Files.writeString(slowSamples, samples("select_feed", "SELECT * FROM content WHERE artistId = 3", 90.0));
    }

    @Test
    void shouldPrintJsonReportAndExitZeroWhenHealthy() {
        // When
        int exitCode = run(healthySamples.toString());

        // Then
        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_OK);
        assertThat(stdout()).contains("\"status\" : \"healthy\"");
    }

    @Test
    void shouldExitTwoWhenUnhealthy() {
        // When
        int exitCode = run(slowSamples.toString(), "--format", "markdown", "--query", "select_feed");

        // Then
        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_UNHEALTHY);
        assertThat(stdout())
                .contains("**Health:** unhealthy")
                .contains("## Query Analysis: `select_feed`");
    }

    @Test
    void shouldApplyThresholdOverridesFromArguments() {
        // When - raising the SLA makes the slow workload acceptable
        int exitCode = run(slowSamples.toString(),
                "--thresholds.slow-query", "200",
                "--thresholds.degraded-p95", "150",
                "--thresholds.critical-risk", "400");

        // Then
        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_OK);
    }

    @Test
    void shouldWriteReportToOutputFile() throws IOException {
        // Given
        Path output = tempDir.resolve("report.md");

        // When
        int exitCode = run(healthySamples.toString(), "-f", "md", "-o", output.toString());

        // Then
        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_OK);
        assertThat(Files.readString(output)).startsWith("# Query Performance Report");
        assertThat(stdout()).contains("Report written to");
    }

    @Test
    void shouldFailForUnknownQuery() {
        // When
        int exitCode = run(healthySamples.toString(), "--query", "missing");

        // Then
        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_ERROR);
        assertThat(stderr()).contains("No performance data available for query: missing");
    }

    @Test
    void shouldFailForMissingSamplesFile() {
        // When
        int exitCode = run(tempDir.resolve("nope.json").toString());

        // Then
        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_ERROR);
        assertThat(stderr()).contains("Samples file not found");
    }

    @Test
    void shouldFailForUnknownProfile() {
        int exitCode = run(healthySamples.toString(), "--profile", "turbo");

        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_ERROR);
        assertThat(stderr()).contains("Unknown performance profile: turbo");
    }

    @Test
    void shouldPrintUsageWithoutArguments() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(TempoCLI.EXIT_ERROR);
        assertThat(stdout()).contains("Usage: java -jar tempo.jar <samples-file> [options]");
    }

    @Test
    void shouldParseOptions() {
        CliOptions options = TempoCLI.parseArgs(new String[]{
                healthySamples.toString(), "--format", "markdown", "--query", "q1", "--profile", "strict"});

        assertThat(options.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(options.getQueryId()).isEqualTo("q1");
        assertThat(options.getProfile()).isEqualTo("strict");
        assertThat(options.getOutputFile()).isNull();
    }

    @Test
    void shouldRejectUnknownOptionsAndFormats() {
        assertThatThrownBy(() -> TempoCLI.parseArgs(new String[]{healthySamples.toString(), "--verbose"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown option: --verbose");
        assertThatThrownBy(() -> TempoCLI.parseArgs(new String[]{healthySamples.toString(), "--format", "xml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
        assertThatThrownBy(() -> TempoCLI.parseArgs(new String[]{healthySamples.toString(), "--query"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Query id not specified");
    }

    private int run(String... args) {
        return TempoCLI.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String samples(String queryId, String query, double executionTimeMs) {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 20; i++) {
            if (i > 0) {
                json.append(",");
            }
            json.append(String.format(java.util.Locale.ROOT,
                    "{\"queryId\":\"%s\",\"rawQueryText\":\"%s\",\"executionTimeMs\":%.1f,"
                            + "\"timestamp\":\"2026-10-18T10:00:%02dZ\",\"cacheHit\":%s}",
                    queryId, query, executionTimeMs, i, i % 2 == 0 ? "false" : "true"));
        }
        return json.append("]").toString();
    }
}
