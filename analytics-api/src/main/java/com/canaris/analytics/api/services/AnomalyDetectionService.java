package com.canaris.analytics.api.services;

import com.canaris.analytics.analysis.AnalysisRequest;
import com.canaris.analytics.analysis.BatchAnalysisResult;
import com.canaris.analytics.analysis.BatchAnalyzer;
import com.canaris.analytics.api.config.AnalyticsProperties;
import com.canaris.analytics.api.dto.AssetAnalysisRequestDto;
import com.canaris.analytics.api.dto.DetectRequestDto;
import com.canaris.analytics.api.dto.DetectionResponseDto;
import com.canaris.analytics.api.dto.ScoreRequestDto;
import com.canaris.analytics.api.dto.StatisticalRequestDto;
import com.canaris.analytics.api.dto.StatisticalResponseDto;
import com.canaris.analytics.exception.ModelNotTrainedException;
import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.features.FeatureVector;
import com.canaris.analytics.model.AnomalyVerdict;
import com.canaris.analytics.model.DetectionMethod;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.UnivariateModel;
import com.canaris.analytics.statistics.StatisticalMethod;
import com.canaris.analytics.statistics.StatisticalScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyDetectionService {

    private static final double DEFAULT_Z_THRESHOLD = 3.0;

    private final DetectorRegistry registry;
    private final FeatureEngineer featureEngineer;
    private final StatisticalScorer scorer;
    private final BatchAnalyzer batchAnalyzer;
    private final AnalyticsProperties properties;
    private final Clock clock;

    /**
     * Scores a whole series with the named model, or by z-score when the model
     * is untrained or ML is switched off.
     */
    public DetectionResponseDto detect(DetectRequestDto request) {
        String name = modelName(request.getModelName());
        double[] values = Conversions.toArray(request.getValues());
        UnivariateModel model = registry.univariate(name);

        List<AnomalyVerdict> verdicts;
        DetectionMethod method;
        String version = null;
        if (!Boolean.FALSE.equals(request.getUseMl()) && model.isTrained()) {
            verdicts = model.predict(featureEngineer.transform(values));
            method = DetectionMethod.ML;
            version = model.getVersion().orElse(null);
        } else {
            double zThreshold = request.getZThreshold() != null ? request.getZThreshold() : DEFAULT_Z_THRESHOLD;
            verdicts = scorer.zScore(values, zThreshold);
            method = DetectionMethod.STATISTICAL;
        }
        int anomalies = (int) verdicts.stream().filter(AnomalyVerdict::isAnomaly).count();
        log.info("Detect on {} values with {} ({}) found {} anomalies", values.length, name, method, anomalies);
        return DetectionResponseDto.builder()
                .modelName(name)
                .modelVersion(version)
                .method(method)
                .total(verdicts.size())
                .anomalyCount(anomalies)
                .verdicts(verdicts)
                .build();
    }

    /**
     * Judges the newest value of a history against the trained boundary.
     */
    public AnomalyVerdict score(ScoreRequestDto request) {
        String name = modelName(request.getModelName());
        UnivariateModel model = registry.univariate(name);
        if (!model.isTrained()) {
            throw new ModelNotTrainedException(name);
        }
        List<FeatureVector> vectors = featureEngineer.transform(Conversions.toArray(request.getValues()));
        return model.detect(vectors.get(vectors.size() - 1));
    }

    public StatisticalResponseDto statistical(StatisticalRequestDto request) {
        StatisticalMethod method = StatisticalMethod.parse(request.getMethod());
        double threshold = request.getThreshold() != null ? request.getThreshold() : method.defaultThreshold();
        double[] values = Conversions.toArray(request.getValues());

        List<AnomalyVerdict> verdicts = scorer.score(values, method, threshold, request.isWithSeverity());
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < verdicts.size(); i++) {
            if (verdicts.get(i).isAnomaly()) {
                indices.add(i);
            }
        }
        return StatisticalResponseDto.builder()
                .method(method)
                .threshold(threshold)
                .anomalyCount(indices.size())
                .anomalyIndices(indices)
                .verdicts(verdicts)
                .summary(scorer.describe(values))
                .build();
    }

    public BatchAnalysisResult analyzeAssets(AssetAnalysisRequestDto request) {
        Instant end = clock.instant();
        Duration lookback = request.getLookbackSeconds() != null
                ? Duration.ofSeconds(request.getLookbackSeconds())
                : properties.getFetch().getDefaultTimeRange();
        AnalysisRequest analysis = AnalysisRequest.builder()
                .metricNames(Conversions.orEmpty(request.getMetricNames()))
                .start(end.minus(lookback))
                .end(end)
                .limit(properties.getFetch().getLimit())
                .useMl(!Boolean.FALSE.equals(request.getUseMl()))
                .modelName(modelName(request.getModelName()))
                .zThreshold(request.getZThreshold() != null ? request.getZThreshold() : DEFAULT_Z_THRESHOLD)
                .build();
        log.info("---Start analysis of {} assets over the last {}s", request.getAssetIds().size(), lookback.toSeconds());
        return batchAnalyzer.analyze(request.getAssetIds(), analysis);
    }

    private String modelName(String requested) {
        return requested == null || requested.isBlank() ? properties.getDefaultModelName() : requested;
    }
}
