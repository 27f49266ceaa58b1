package org.carball.tempo.model.recommendation;

public enum ImplementationComplexity {
    LOW,
    MEDIUM,
    HIGH
}
