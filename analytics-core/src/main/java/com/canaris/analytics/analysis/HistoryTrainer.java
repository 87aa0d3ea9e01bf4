package com.canaris.analytics.analysis;

import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.source.MetricSample;
import com.canaris.analytics.source.MetricSeries;
import com.canaris.analytics.source.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Builds a training set from stored history: every series that reaches the
 * sample floor is featurised and the vectors of all assets are concatenated.
 * Assets whose history cannot be fetched are reported and left out.
 */
@Slf4j
@RequiredArgsConstructor
public class HistoryTrainer {

    private final MetricSource source;
    private final FeatureEngineer featureEngineer;
    private final Executor fetchExecutor;

    public TrainingSet collect(List<String> assetIds, String metricName, Instant start, Instant end, int limit) {
        List<CompletableFuture<List<MetricSample>>> fetches = new ArrayList<>(assetIds.size());
        for (String assetId : assetIds) {
            fetches.add(CompletableFuture.supplyAsync(
                    () -> source.fetch(assetId, metricName, start, end, limit), fetchExecutor));
        }

        int minSamples = featureEngineer.getConfig().getMinSamples();
        TrainingSet.TrainingSetBuilder set = TrainingSet.builder()
                .featureNames(featureEngineer.getConfig().featureNames())
                .assets(assetIds.size());
        int used = 0;
        int skipped = 0;
        for (int i = 0; i < assetIds.size(); i++) {
            String assetId = assetIds.get(i);
            List<MetricSample> samples;
            try {
                samples = fetches.get(i).join();
            } catch (CompletionException e) {
                log.warn("Skipping asset {} for training: {}", assetId, e.getCause().getMessage());
                set.failedAsset(assetId);
                continue;
            }
            for (MetricSeries series : MetricSeries.groupByMetric(assetId, samples)) {
                if (series.size() < minSamples) {
                    skipped++;
                    continue;
                }
                set.vectors(featureEngineer.transform(series.values()));
                used++;
            }
        }
        TrainingSet result = set.seriesUsed(used).seriesSkipped(skipped).build();
        log.info("Collected {} training vectors from {} series across {} assets ({} series skipped)",
                result.size(), used, assetIds.size(), skipped);
        return result;
    }
}
