package com.canaris.analytics.statistics;

import java.util.Locale;

public enum StatisticalMethod {
    /** |value - mean| / std above the threshold. */
    ZSCORE(3.0),
    /** Outside [Q1 - m*IQR, Q3 + m*IQR]; the threshold is the multiplier m. */
    IQR(1.5),
    /** Modified z-score 0.6745 * (value - median) / MAD above the threshold. */
    MAD(3.0);

    private final double defaultThreshold;

    StatisticalMethod(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public double defaultThreshold() {
        return defaultThreshold;
    }

    public static StatisticalMethod parse(String name) {
        if (name == null || name.isBlank()) {
            return ZSCORE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown method: " + name, e);
        }
    }
}
