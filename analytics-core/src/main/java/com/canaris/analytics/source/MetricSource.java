package com.canaris.analytics.source;

import java.time.Instant;
import java.util.List;

/**
 * Supplies raw metric history to the engine.
 * <p>
 * Implementations return an empty list when there is nothing stored for the
 * requested window, and raise {@link com.canaris.analytics.exception.UpstreamFetchException}
 * when the upstream store cannot be read.
 */
public interface MetricSource {

    /**
     * @param assetId    asset to read
     * @param metricName metric to read, or {@code null} for every metric of the asset
     * @param start      inclusive lower bound
     * @param end        inclusive upper bound
     * @param limit      maximum number of samples returned
     */
    List<MetricSample> fetch(String assetId, String metricName, Instant start, Instant end, int limit);
}
