package com.canaris.analytics.exception;

import lombok.Getter;

/**
 * Raised by a {@link com.canaris.analytics.source.MetricSource} when the upstream data source cannot be read.
 */
@Getter
public class UpstreamFetchException extends AnalyticsException {

    private final String assetId;

    public UpstreamFetchException(String assetId, String message, Throwable cause) {
        super("Failed to fetch metrics for asset " + assetId + ": " + message, cause);
        this.assetId = assetId;
    }
}
