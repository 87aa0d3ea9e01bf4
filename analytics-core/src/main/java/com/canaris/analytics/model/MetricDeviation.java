package com.canaris.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * One metric that sits more than three training deviations from its training mean.
 */
@Value
@Builder
public class MetricDeviation {
    String metric;
    double value;
    double zScore;
    double mean;
    double std;
    double expectedLow;
    double expectedHigh;
}
