package com.canaris.analytics.correlation;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    /** Case-insensitive; unknown or missing values read as {@link #INFO}. */
    public static Severity parse(String value) {
        if (value == null) {
            return INFO;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return INFO;
    }
}
