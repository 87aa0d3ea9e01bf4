package com.canaris.analytics.rootcause;

public enum ImpactLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ImpactLevel of(double impact) {
        if (impact > 70) {
            return HIGH;
        }
        if (impact > 40) {
            return MEDIUM;
        }
        return LOW;
    }
}
