package com.canaris.analytics.correlation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An alert as seen by the correlator. Never modified by it.
 */
@Value
@Builder
public class Alert {
    String id;
    String assetId;
    /** Asset already blamed for this alert upstream; takes precedence over {@link #assetId} for grouping. */
    String rootCauseAssetId;
    String fingerprint;
    @Builder.Default
    Severity severity = Severity.INFO;
    Instant createdAt;
    Double businessImpactScore;

    String groupingAssetId() {
        return rootCauseAssetId != null && !rootCauseAssetId.isBlank() ? rootCauseAssetId : assetId;
    }

    double impactOrZero() {
        return businessImpactScore == null ? 0.0 : businessImpactScore;
    }
}
