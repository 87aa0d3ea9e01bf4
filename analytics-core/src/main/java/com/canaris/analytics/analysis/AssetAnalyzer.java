package com.canaris.analytics.analysis;

import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.features.FeatureVector;
import com.canaris.analytics.model.AnomalyVerdict;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.UnivariateModel;
import com.canaris.analytics.source.MetricSample;
import com.canaris.analytics.source.MetricSeries;
import com.canaris.analytics.source.MetricSource;
import com.canaris.analytics.statistics.StatisticalScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores the recent history of one asset. Each metric series is scored by
 * the named univariate model when it is trained, otherwise by z-score.
 * Only anomalous points are returned.
 */
@Slf4j
@RequiredArgsConstructor
public class AssetAnalyzer {

    private final MetricSource source;
    private final FeatureEngineer featureEngineer;
    private final StatisticalScorer scorer;
    private final DetectorRegistry detectors;

    public AssetAnalysisResult analyze(String assetId, AnalysisRequest request) {
        List<MetricSample> samples = fetch(assetId, request);
        if (samples.isEmpty()) {
            log.info("No metric history for asset {}", assetId);
            return AssetAnalysisResult.builder().assetId(assetId).success(true).build();
        }

        UnivariateModel model = request.isUseMl() && request.getModelName() != null
                ? detectors.univariate(request.getModelName())
                : null;
        int minSamples = featureEngineer.getConfig().getMinSamples();

        AssetAnalysisResult.AssetAnalysisResultBuilder result = AssetAnalysisResult.builder()
                .assetId(assetId)
                .success(true);
        int analyzed = 0;
        int skipped = 0;
        int points = 0;
        int anomalies = 0;
        for (MetricSeries series : MetricSeries.groupByMetric(assetId, samples)) {
            if (series.size() < minSamples) {
                log.debug("Skipping {}/{}: {} samples below floor {}", assetId, series.getMetricName(), series.size(), minSamples);
                skipped++;
                continue;
            }
            List<AnomalyVerdict> verdicts = score(series, model, request);
            for (int i = 0; i < verdicts.size(); i++) {
                AnomalyVerdict verdict = verdicts.get(i);
                if (verdict.isAnomaly()) {
                    anomalies++;
                    result.finding(AnomalyFinding.builder()
                            .assetId(assetId)
                            .metricName(series.getMetricName())
                            .timestamp(series.timestampAt(i))
                            .value(verdict.getValue())
                            .score(verdict.getScore())
                            .threshold(verdict.getThreshold())
                            .method(verdict.getMethod())
                            .build());
                }
            }
            analyzed++;
            points += series.size();
        }
        log.info("Asset {}: {} series analyzed, {} skipped, {} anomalies", assetId, analyzed, skipped, anomalies);
        return result.seriesAnalyzed(analyzed).seriesSkipped(skipped).pointsAnalyzed(points).build();
    }

    private List<AnomalyVerdict> score(MetricSeries series, UnivariateModel model, AnalysisRequest request) {
        double[] values = series.values();
        if (model != null && model.isTrained()) {
            List<FeatureVector> vectors = featureEngineer.transform(values);
            return model.predict(vectors);
        }
        return scorer.zScore(values, request.getZThreshold());
    }

    private List<MetricSample> fetch(String assetId, AnalysisRequest request) {
        if (request.getMetricNames().isEmpty()) {
            return source.fetch(assetId, null, request.getStart(), request.getEnd(), request.getLimit());
        }
        List<MetricSample> samples = new ArrayList<>();
        for (String metric : request.getMetricNames()) {
            samples.addAll(source.fetch(assetId, metric, request.getStart(), request.getEnd(), request.getLimit()));
        }
        return samples;
    }
}
