package org.carball.tempo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> env;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public OptimizerConfig loadConfiguration(String[] args) {
        return loadConfiguration(null, PerformanceProfile.DEFAULT.getName(), args);
    }

    /**
     * Loads configuration from a specific profile.
     */
    public OptimizerConfig loadProfile(String profileName) {
        try {
            PerformanceProfile profile = PerformanceProfile.fromName(profileName);
            OptimizerConfig config = profile.buildConfig();
            log.info("Loaded profile '{}': {}", profileName, config.getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with other configuration sources.
     */
    public OptimizerConfig loadConfigurationWithProfile(String profileName, String[] args) {
        return loadConfiguration(null, profileName, args);
    }

    /**
     * Full hierarchy: CLI args > env vars > YAML file > profile > defaults.
     */
    public OptimizerConfig loadConfiguration(Path thresholdFile, String profileName, String[] args) {
        log.debug("Loading configuration");

        OptimizerConfig.OptimizerConfigBuilder builder = loadProfile(profileName).toBuilder();

        if (thresholdFile != null) {
            ThresholdConfig fileConfig = loadThresholdFile(thresholdFile);
            if (fileConfig != null) {
                fileConfig.applyTo(builder);
            }
        }

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        OptimizerConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads a YAML threshold file. A missing file is logged and ignored.
     */
    public ThresholdConfig loadThresholdFile(Path path) {
        if (!Files.exists(path)) {
            log.warn("Threshold config file not found: {}, using profile values", path);
            return null;
        }

        try {
            ThresholdConfig config = yamlMapper.readValue(path.toFile(), ThresholdConfig.class);
            log.info("Loaded threshold overrides from {}", path);
            return config;
        } catch (IOException e) {
            log.error("Error reading threshold config {}: {}", path, e.getMessage());
            throw new IllegalArgumentException("Invalid threshold config file: " + path, e);
        }
    }

    private void applyEnvironmentVariables(OptimizerConfig.OptimizerConfigBuilder builder) {
        applyEnv("TEMPO_SLOW_QUERY_THRESHOLD_MS", v -> builder.slowQueryThresholdMs(Double.parseDouble(v)));
        applyEnv("TEMPO_DEGRADED_P95_THRESHOLD_MS", v -> builder.degradedP95ThresholdMs(Double.parseDouble(v)));
        applyEnv("TEMPO_SLOW_QUERY_FRACTION", v -> builder.slowQueryFractionThreshold(Double.parseDouble(v)));
        applyEnv("TEMPO_MAX_SAMPLES_PER_QUERY", v -> builder.maxSamplesPerQuery(Integer.parseInt(v)));
        applyEnv("TEMPO_DEFAULT_TTL_MS", v -> builder.defaultTtlMs(Long.parseLong(v)));
        applyEnv("TEMPO_BACKGROUND_THREADS", v -> builder.backgroundThreads(Integer.parseInt(v)));
        applyEnv("TEMPO_READ_ONLY_MARKERS", v -> builder.readOnlyMarkers(splitMarkers(v)));
    }

    private void applyEnv(String name, Consumer<String> setter) {
        if (!env.containsKey(name)) {
            return;
        }
        try {
            setter.accept(env.get(name));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, env.get(name));
        }
    }

    private void applyCLIArguments(OptimizerConfig.OptimizerConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.slow-query":
                        builder.slowQueryThresholdMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.degraded-p95":
                        builder.degradedP95ThresholdMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.slow-fraction":
                        builder.slowQueryFractionThreshold(Double.parseDouble(value));
                        break;
                    case "--thresholds.critical-risk":
                        builder.criticalRiskThresholdMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.medium-risk":
                        builder.mediumRiskThresholdMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.cache-hit-rate":
                        builder.lowCacheHitRatePercent(Double.parseDouble(value));
                        break;
                    case "--cache.min-execution-ms":
                        builder.minCacheableExecutionMs(Double.parseDouble(value));
                        break;
                    case "--cache.max-result-size":
                        builder.maxCacheableResultSize(Integer.parseInt(value));
                        break;
                    case "--cache.default-ttl-ms":
                        builder.defaultTtlMs(Long.parseLong(value));
                        break;
                    case "--metrics.max-samples":
                        builder.maxSamplesPerQuery(Integer.parseInt(value));
                        break;
                    case "--metrics.retention-ms":
                        builder.sampleRetentionMs(Long.parseLong(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    private static List<String> splitMarkers(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.slow-query <ms>          Slow query / p95 SLA threshold (default 50)
              --thresholds.degraded-p95 <ms>        p95 above which health is degraded (default 35)
              --thresholds.slow-fraction <ratio>    Slow query fraction for degraded health (default 0.10)
              --thresholds.critical-risk <ms>       p95 above which risk is CRITICAL (default 100)
              --thresholds.medium-risk <ms>         p95 above which risk is MEDIUM (default 25)
              --thresholds.cache-hit-rate <pct>     Hit rate below which caching is recommended (default 60)
              --cache.min-execution-ms <ms>         Minimum execution time for caching (default 10)
              --cache.max-result-size <num>         Largest cacheable collection (default 1000)
              --cache.default-ttl-ms <ms>           Default cache TTL (default 300000)
              --metrics.max-samples <num>           Samples retained per query (default 1000)
              --metrics.retention-ms <ms>           Sample retention window (default 86400000)

            Environment Variables:
              TEMPO_SLOW_QUERY_THRESHOLD_MS         Same as --thresholds.slow-query
              TEMPO_DEGRADED_P95_THRESHOLD_MS       Same as --thresholds.degraded-p95
              TEMPO_SLOW_QUERY_FRACTION             Same as --thresholds.slow-fraction
              TEMPO_MAX_SAMPLES_PER_QUERY           Same as --metrics.max-samples
              TEMPO_DEFAULT_TTL_MS                  Same as --cache.default-ttl-ms
              TEMPO_BACKGROUND_THREADS              Background refresh pool size
              TEMPO_READ_ONLY_MARKERS               Comma separated queryId markers for cacheable queries

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML threshold file (--config)
              4. Profile defaults or built-in defaults
            """;
    }
}
