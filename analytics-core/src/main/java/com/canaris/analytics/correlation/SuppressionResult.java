package com.canaris.analytics.correlation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SuppressionResult {
    @Singular
    List<SuppressionSuggestion> suggestions;
    int totalAlerts;
    int suppressibleAlerts;
    /** Share of all alerts that could be suppressed, in percent, rounded to 2 decimals. */
    double noiseReductionPercent;
}
