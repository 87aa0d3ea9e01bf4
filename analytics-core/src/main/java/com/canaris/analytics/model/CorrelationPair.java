package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CorrelationPair {
    String metricA;
    String metricB;
    double coefficient;
    double pValue;
    CorrelationStrength strength;

    /** "positive" or "negative". */
    String direction;
}
