package com.canaris.analytics.rootcause;

import com.canaris.analytics.correlation.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EventRecord {
    String id;
    String assetId;
    @Builder.Default
    Severity severity = Severity.INFO;
    Instant occurredAt;
}
