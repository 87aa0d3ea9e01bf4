package com.canaris.analytics.source;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Readings of a single metric on a single asset, sorted ascending by timestamp on construction.
 */
@Getter
public class MetricSeries {

    private final String assetId;
    private final String metricName;
    private final List<MetricSample> samples;

    public MetricSeries(String assetId, String metricName, List<MetricSample> samples) {
        this.assetId = assetId;
        this.metricName = metricName;
        List<MetricSample> sorted = new ArrayList<>(samples);
        sorted.sort(Comparator.comparing(MetricSample::getTimestamp));
        this.samples = List.copyOf(sorted);
    }

    /** Splits a mixed fetch result into one series per metric name, in order of first appearance. */
    public static List<MetricSeries> groupByMetric(String assetId, List<MetricSample> samples) {
        Map<String, List<MetricSample>> byMetric = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            String name = sample.getMetricName() == null ? "value" : sample.getMetricName();
            byMetric.computeIfAbsent(name, k -> new ArrayList<>()).add(sample);
        }
        List<MetricSeries> series = new ArrayList<>();
        byMetric.forEach((name, points) -> series.add(new MetricSeries(assetId, name, points)));
        return series;
    }

    public int size() {
        return samples.size();
    }

    public double[] values() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getValue();
        }
        return values;
    }

    public Instant timestampAt(int index) {
        return samples.get(index).getTimestamp();
    }
}
