package org.carball.tempo.model.query;

public record Percentiles(double p50, double p95, double p99) {

    public static final Percentiles ZERO = new Percentiles(0, 0, 0);
}
