package com.canaris.analytics.correlation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationGroup {
    CorrelationType type;
    String key;
    /** Member ids in the order the alerts were supplied. */
    List<String> alertIds;
    double correlationScore;
    String reason;

    public int getAlertCount() {
        return alertIds.size();
    }
}
