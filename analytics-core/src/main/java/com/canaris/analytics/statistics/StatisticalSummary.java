package com.canaris.analytics.statistics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StatisticalSummary {
    int count;
    double mean;
    double median;
    double std;
    double variance;
    double min;
    double max;
    double q25;
    double q75;
}
