package org.carball.tempo.cli;

import lombok.Data;
import org.carball.tempo.config.OutputFormat;

import java.nio.file.Path;

@Data
public class CliOptions {
    private Path samplesFile;
    private OutputFormat outputFormat = OutputFormat.JSON;
    private String queryId;
    private Path configFile;
    private String profile = "default";
    private Path outputFile;
}
