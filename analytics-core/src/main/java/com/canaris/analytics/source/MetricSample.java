package com.canaris.analytics.source;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One reading as returned by a {@link MetricSource}.
 */
@Value
@Builder
public class MetricSample {
    String assetId;
    String metricName;
    Instant timestamp;
    double value;
}
