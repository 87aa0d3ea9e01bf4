package com.canaris.analytics.rootcause;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BusinessImpact {
    int businessImpactScore;
    long affectedUsers;
    double revenueAtRisk;
    ImpactLevel impactLevel;
}
