package org.carball.tempo.config;

public enum OutputFormat {
    JSON("json"),
    MARKDOWN("md");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
