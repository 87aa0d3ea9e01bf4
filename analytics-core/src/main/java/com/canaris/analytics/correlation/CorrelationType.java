package com.canaris.analytics.correlation;

public enum CorrelationType {
    FINGERPRINT(0.9, "Same event fingerprint - likely same root cause"),
    ASSET(0.7, "Same asset affected - related infrastructure issue"),
    TIME_CLUSTER(0.6, "Alerts within %d minutes - possible cascading failure");

    private final double score;
    private final String reason;

    CorrelationType(double score, String reason) {
        this.score = score;
        this.reason = reason;
    }

    public double score() {
        return score;
    }

    String reason(long windowMinutes) {
        return this == TIME_CLUSTER ? String.format(reason, windowMinutes) : reason;
    }
}
