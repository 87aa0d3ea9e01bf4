package com.canaris.analytics.model;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    DEGRADED,
    CRITICAL;

    public static HealthStatus of(double score) {
        if (score >= 80) {
            return HEALTHY;
        }
        if (score >= 60) {
            return WARNING;
        }
        if (score >= 40) {
            return DEGRADED;
        }
        return CRITICAL;
    }
}
