package com.canaris.analytics.analysis;

import com.canaris.analytics.model.DetectionMethod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AnomalyFinding {
    String assetId;
    String metricName;
    Instant timestamp;
    double value;
    double score;
    double threshold;
    DetectionMethod method;
}
