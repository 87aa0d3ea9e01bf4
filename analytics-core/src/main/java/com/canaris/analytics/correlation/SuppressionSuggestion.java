package com.canaris.analytics.correlation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SuppressionSuggestion {
    CorrelationType groupType;
    String keepAlertId;
    List<String> suppressAlertIds;
    String reason;

    public int getAlertsToSuppress() {
        return suppressAlertIds.size();
    }
}
