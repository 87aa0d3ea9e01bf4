package com.canaris.analytics.api.config;

import com.canaris.analytics.analysis.AssetAnalyzer;
import com.canaris.analytics.analysis.BatchAnalyzer;
import com.canaris.analytics.analysis.HistoryTrainer;
import com.canaris.analytics.correlation.AlertCorrelator;
import com.canaris.analytics.features.FeatureConfig;
import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.forest.ForestOptions;
import com.canaris.analytics.model.DetectorConfig;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.rootcause.RootCauseRanker;
import com.canaris.analytics.source.MetricSource;
import com.canaris.analytics.statistics.StatisticalScorer;
import com.canaris.analytics.store.ModelStateRepository;
import com.canaris.analytics.store.ModelStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the analytics engine from {@link AnalyticsProperties}.
 */
@Configuration
public class AnalyticsEngineConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    FeatureEngineer featureEngineer(AnalyticsProperties properties) {
        FeatureConfig config = FeatureConfig.builder()
                .rollingWindows(properties.getFeatures().getRollingWindows())
                .lags(properties.getFeatures().getLags())
                .minSamples(properties.getMinSamples())
                .build();
        return new FeatureEngineer(config);
    }

    @Bean
    StatisticalScorer statisticalScorer() {
        return new StatisticalScorer();
    }

    @Bean
    ModelStore modelStore(ModelStateRepository repository, Clock clock) {
        return new ModelStore(repository, clock);
    }

    @Bean
    DetectorRegistry detectorRegistry(ModelStore modelStore, AnalyticsProperties properties) {
        DetectorConfig config = DetectorConfig.builder()
                .threshold(properties.getThreshold())
                .contamination(properties.getContamination())
                .minSamples(properties.getMinSamples())
                .forest(ForestOptions.builder()
                        .trees(properties.getForest().getTrees())
                        .subsample(properties.getForest().getSubsample())
                        .seed(properties.getForest().getSeed())
                        .build())
                .build();
        return new DetectorRegistry(modelStore, config);
    }

    @Bean
    AlertCorrelator alertCorrelator(Clock clock) {
        return new AlertCorrelator(clock);
    }

    @Bean
    RootCauseRanker rootCauseRanker(Clock clock) {
        return new RootCauseRanker(clock);
    }

    @Bean
    AssetAnalyzer assetAnalyzer(MetricSource metricSource, FeatureEngineer featureEngineer,
                                StatisticalScorer statisticalScorer, DetectorRegistry detectorRegistry) {
        return new AssetAnalyzer(metricSource, featureEngineer, statisticalScorer, detectorRegistry);
    }

    @Bean(destroyMethod = "close")
    BatchAnalyzer batchAnalyzer(AssetAnalyzer assetAnalyzer, AnalyticsProperties properties) {
        return new BatchAnalyzer(assetAnalyzer, properties.getBatch().getConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("historyFetchExecutor")
    ExecutorService historyFetchExecutor(AnalyticsProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatch().getConcurrency(), BatchAnalyzer.namedThreads("history-fetch"));
    }

    @Bean
    HistoryTrainer historyTrainer(MetricSource metricSource, FeatureEngineer featureEngineer,
                                  @Qualifier("historyFetchExecutor") ExecutorService historyFetchExecutor) {
        return new HistoryTrainer(metricSource, featureEngineer, historyFetchExecutor);
    }

    /** Training never runs on request threads. */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("trainingExecutor")
    ExecutorService trainingExecutor(AnalyticsProperties properties) {
        return Executors.newFixedThreadPool(properties.getTraining().getThreads(), BatchAnalyzer.namedThreads("model-training"));
    }
}
