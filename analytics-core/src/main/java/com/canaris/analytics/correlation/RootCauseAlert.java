package com.canaris.analytics.correlation;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RootCauseAlert {
    String alertId;
    double score;
    double confidence;
    String reason;
}
