package org.carball.tempo.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.tempo.QueryOptimizer;
import org.carball.tempo.analyzer.NoPerformanceDataException;
import org.carball.tempo.cache.InMemoryCacheStore;
import org.carball.tempo.config.ConfigurationLoader;
import org.carball.tempo.config.OptimizerConfig;
import org.carball.tempo.config.OutputFormat;
import org.carball.tempo.config.PerformanceProfile;
import org.carball.tempo.model.analysis.HealthReport;
import org.carball.tempo.model.analysis.HealthStatus;
import org.carball.tempo.model.analysis.OptimizationPlan;
import org.carball.tempo.model.analysis.PerformanceReport;
import org.carball.tempo.model.analysis.QueryAnalysis;
import org.carball.tempo.model.query.QuerySample;
import org.carball.tempo.output.PerformanceReportWriter;
import org.carball.tempo.parser.SampleFileLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Offline analysis of recorded samples: replays a sample export into a fresh metric store and
 * prints the workload report, the health verdict and optionally one query's analysis.
 */
@Slf4j
public class TempoCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_UNHEALTHY = 2;

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || isHelpRequested(args)) {
            printUsage(out);
            return args.length < 1 ? EXIT_ERROR : EXIT_OK;
        }

        try {
            CliOptions options = parseArgs(args);
            OptimizerConfig config = new ConfigurationLoader()
                    .loadConfiguration(options.getConfigFile(), options.getProfile(), args);

            List<QuerySample> samples = new SampleFileLoader().load(options.getSamplesFile());

            try (QueryOptimizer optimizer = new QueryOptimizer(config, new InMemoryCacheStore(),
                    Clock.systemUTC(), false)) {
                samples.forEach(optimizer.getMetricStore()::record);

                PerformanceReport report = optimizer.globalReport();
                HealthReport health = optimizer.healthCheck();
                OptimizationPlan plan = optimizer.applyAutomaticOptimizations();
                QueryAnalysis analysis = options.getQueryId() != null
                        ? optimizer.analyze(options.getQueryId())
                        : null;

                PerformanceReportWriter writer = new PerformanceReportWriter(report, health, plan, analysis);
                String rendered = options.getOutputFormat() == OutputFormat.MARKDOWN
                        ? writer.toMarkdown()
                        : writer.toJson();

                if (options.getOutputFile() != null) {
                    Files.writeString(options.getOutputFile(), rendered);
                    out.println("Report written to " + options.getOutputFile());
                } else {
                    out.println(rendered);
                }

                log.info("Analyzed {} samples across {} queries, health={}",
                        samples.size(), optimizer.getMetricStore().queryIds().size(), health.status().getValue());
                return health.status() == HealthStatus.UNHEALTHY ? EXIT_UNHEALTHY : EXIT_OK;
            }

        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (NoPerformanceDataException e) {
            err.println("Analysis error: " + e.getMessage());
            log.debug("Analysis error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            err.println("Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("Tempo query performance analyzer v" + VERSION);
        out.println();
        out.println("Usage: java -jar tempo.jar <samples-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  samples-file        JSON array of recorded query samples");
        out.println();
        out.println("Options:");
        out.println("  --format, -f        Output format: json|markdown (default: json)");
        out.println("  --query, -q         Include the analysis of one queryId");
        out.println("  --config            YAML file with threshold overrides");
        out.println("  --profile           Threshold profile: " + PerformanceProfile.getAvailableProfiles()
                + " (default: default)");
        out.println("  --output, -o        Write the report to a file instead of stdout");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(ConfigurationLoader.getThresholdHelp());
        out.println("Exit codes: 0 healthy or degraded, 2 unhealthy, 1 error");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();
        options.setSamplesFile(Paths.get(args[0]));

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--format":
                case "-f":
                    options.setOutputFormat(parseFormat(requireValue(args, i++, "Output format")));
                    break;

                case "--query":
                case "-q":
                    options.setQueryId(requireValue(args, i++, "Query id"));
                    break;

                case "--config":
                    options.setConfigFile(Paths.get(requireValue(args, i++, "Threshold config file")));
                    break;

                case "--profile":
                    options.setProfile(requireValue(args, i++, "Profile"));
                    break;

                case "--output":
                case "-o":
                    options.setOutputFile(Paths.get(requireValue(args, i++, "Output file")));
                    break;

                default:
                    if (isThresholdOverride(arg)) {
                        // applied by ConfigurationLoader
                        requireValue(args, i++, arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        validateOptions(options);
        return options;
    }

    private static String requireValue(String[] args, int index, String what) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(what + " not specified");
        }
        return args[index + 1];
    }

    private static OutputFormat parseFormat(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "json":
                return OutputFormat.JSON;
            case "markdown":
            case "md":
                return OutputFormat.MARKDOWN;
            default:
                throw new IllegalArgumentException("Invalid output format. Use: json or markdown");
        }
    }

    private static boolean isThresholdOverride(String arg) {
        return arg.startsWith("--thresholds.") || arg.startsWith("--cache.") || arg.startsWith("--metrics.");
    }

    private static void validateOptions(CliOptions options) {
        if (!Files.exists(options.getSamplesFile())) {
            throw new IllegalArgumentException("Samples file not found: " + options.getSamplesFile());
        }

        if (options.getOutputFile() != null) {
            Path outputDir = options.getOutputFile().toAbsolutePath().getParent();
            if (outputDir != null && !Files.exists(outputDir)) {
                throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
            }
        }
    }
}
