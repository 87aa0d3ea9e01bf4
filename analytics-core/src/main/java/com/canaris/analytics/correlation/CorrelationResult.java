package com.canaris.analytics.correlation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationResult {
    int totalAlerts;
    @Singular
    List<CorrelationGroup> groups;
    boolean alertStormDetected;
    int uniqueFingerprints;
    int uniqueAssets;
    int timeClusters;
}
