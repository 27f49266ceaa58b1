package org.carball.tempo.model.analysis;

import org.carball.tempo.model.recommendation.Priority;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Step function of p95 latency. All comparisons are strict.
     */
    public static RiskLevel fromP95(double p95Ms, double mediumMs, double highMs, double criticalMs) {
        if (p95Ms > criticalMs) {
            return CRITICAL;
        } else if (p95Ms > highMs) {
            return HIGH;
        } else if (p95Ms > mediumMs) {
            return MEDIUM;
        } else {
            return LOW;
        }
    }

    public Priority toPriority() {
        return Priority.valueOf(name());
    }
}
