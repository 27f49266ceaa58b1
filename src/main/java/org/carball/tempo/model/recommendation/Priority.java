package org.carball.tempo.model.recommendation;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
