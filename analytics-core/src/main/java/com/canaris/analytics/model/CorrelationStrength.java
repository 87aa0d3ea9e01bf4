package com.canaris.analytics.model;

public enum CorrelationStrength {
    NEGLIGIBLE,
    WEAK,
    MODERATE,
    STRONG;

    public static CorrelationStrength of(double coefficient) {
        double r = Math.abs(coefficient);
        if (r < 0.2) {
            return NEGLIGIBLE;
        }
        if (r < 0.4) {
            return WEAK;
        }
        if (r < 0.7) {
            return MODERATE;
        }
        return STRONG;
    }
}
