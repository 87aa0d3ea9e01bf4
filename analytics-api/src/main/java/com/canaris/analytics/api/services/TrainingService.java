package com.canaris.analytics.api.services;

import com.canaris.analytics.analysis.HistoryTrainer;
import com.canaris.analytics.analysis.TrainingSet;
import com.canaris.analytics.api.config.AnalyticsProperties;
import com.canaris.analytics.api.dto.MultiMetricTrainRequestDto;
import com.canaris.analytics.api.dto.TrainRequestDto;
import com.canaris.analytics.api.dto.TrainResponseDto;
import com.canaris.analytics.exception.AnalyticsException;
import com.canaris.analytics.exception.InsufficientDataException;
import com.canaris.analytics.exception.TrainingTimeoutException;
import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.features.FeatureVector;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.MultivariateModel;
import com.canaris.analytics.model.TrainingSummary;
import com.canaris.analytics.model.UnivariateModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fits detectors on the training executor. A fit that outlives
 * {@code analytics.training.timeout} is cancelled and nothing is stored.
 */
@Slf4j
@Service
public class TrainingService {

    private final DetectorRegistry registry;
    private final FeatureEngineer featureEngineer;
    private final HistoryTrainer historyTrainer;
    private final AnalyticsProperties properties;
    private final ExecutorService trainingExecutor;
    private final Clock clock;

    public TrainingService(DetectorRegistry registry,
                           FeatureEngineer featureEngineer,
                           HistoryTrainer historyTrainer,
                           AnalyticsProperties properties,
                           @Qualifier("trainingExecutor") ExecutorService trainingExecutor,
                           Clock clock) {
        this.registry = registry;
        this.featureEngineer = featureEngineer;
        this.historyTrainer = historyTrainer;
        this.properties = properties;
        this.trainingExecutor = trainingExecutor;
        this.clock = clock;
    }

    public TrainResponseDto trainUnivariate(TrainRequestDto request) {
        String name = modelName(request.getModelName());
        double contamination = contamination(request.getContamination());
        UnivariateModel model = registry.univariate(name);

        if (request.getValues() != null && !request.getValues().isEmpty()) {
            log.info("---Start training '{}' on {} supplied values", name, request.getValues().size());
            List<FeatureVector> vectors = featureEngineer.transform(Conversions.toArray(request.getValues()));
            List<String> featureNames = featureEngineer.getConfig().featureNames();
            TrainingSummary summary = runWithTimeout(name, () -> model.train(vectors, featureNames, contamination));
            return TrainResponseDto.builder()
                    .summary(summary)
                    .seriesUsed(1)
                    .failedAssets(List.of())
                    .build();
        }

        if (request.getAssetIds() == null || request.getAssetIds().isEmpty()) {
            throw new IllegalArgumentException("Either values or assetIds must be provided");
        }
        Instant end = clock.instant();
        Instant start = end.minus(lookback(request.getLookbackSeconds()));
        log.info("---Start training '{}' from history of {} assets, metric {}, since {}",
                name, request.getAssetIds().size(), request.getMetricName(), start);
        TrainingSet set = historyTrainer.collect(request.getAssetIds(), request.getMetricName(), start, end,
                properties.getFetch().getLimit());
        if (set.size() < properties.getMinTrainingSamples()) {
            throw new InsufficientDataException("training '" + name + "' from history",
                    properties.getMinTrainingSamples(), set.size());
        }
        TrainingSummary summary = runWithTimeout(name,
                () -> model.train(set.getVectors(), set.getFeatureNames(), contamination));
        return TrainResponseDto.builder()
                .summary(summary)
                .seriesUsed(set.getSeriesUsed())
                .failedAssets(set.getFailedAssets())
                .build();
    }

    public TrainingSummary trainMultivariate(String modelName, MultiMetricTrainRequestDto request) {
        Map<String, double[]> metrics = Conversions.toArrays(request.getMetrics());
        double contamination = contamination(request.getContamination());
        MultivariateModel model = registry.multivariate(modelName);
        log.info("---Start training multivariate '{}' on metrics {}", modelName, metrics.keySet());
        return runWithTimeout(modelName, () -> model.train(metrics, contamination));
    }

    <T> T runWithTimeout(String modelName, Callable<T> task) {
        Duration timeout = properties.getTraining().getTimeout();
        Future<T> future = trainingExecutor.submit(task);
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("--- Training of '{}' completed", modelName);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Training of '{}' exceeded {}s, cancelled", modelName, timeout.toSeconds());
            throw new TrainingTimeoutException(modelName, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new AnalyticsException("Training of '" + modelName + "' failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalyticsException("Interrupted while training '" + modelName + "'", e);
        }
    }

    private String modelName(String requested) {
        return requested == null || requested.isBlank() ? properties.getDefaultModelName() : requested;
    }

    private double contamination(Double requested) {
        return requested != null ? requested : properties.getContamination();
    }

    private Duration lookback(Long seconds) {
        return seconds != null ? Duration.ofSeconds(seconds) : properties.getFetch().getDefaultTimeRange();
    }
}
