package com.canaris.analytics.api.services;

import com.canaris.analytics.analysis.HistoryTrainer;
import com.canaris.analytics.analysis.TrainingSet;
import com.canaris.analytics.api.config.AnalyticsProperties;
import com.canaris.analytics.api.dto.TrainRequestDto;
import com.canaris.analytics.api.dto.TrainResponseDto;
import com.canaris.analytics.exception.InsufficientDataException;
import com.canaris.analytics.exception.TrainingTimeoutException;
import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.features.FeatureVector;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.TrainingSummary;
import com.canaris.analytics.model.UnivariateModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrainingServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-05T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private DetectorRegistry registry;
    @Mock
    private HistoryTrainer historyTrainer;
    @Mock
    private UnivariateModel model;

    private final AnalyticsProperties properties = new AnalyticsProperties();
    private ExecutorService executor;
    private TrainingService service;

    @BeforeEach
    void setUp() {
        properties.getTraining().setTimeout(Duration.ofMillis(200));
        properties.setMinTrainingSamples(50);
        executor = Executors.newSingleThreadExecutor();
        service = new TrainingService(registry, new FeatureEngineer(), historyTrainer, properties, executor, CLOCK);
        when(registry.univariate("default")).thenReturn(model);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void trainsOnSuppliedValues() {
        TrainingSummary summary = TrainingSummary.builder().modelName("default").version("v1").samples(30).build();
        when(model.train(anyList(), anyList(), eq(0.1))).thenReturn(summary);

        TrainResponseDto response = service.trainUnivariate(TrainRequestDto.builder().values(values(30)).build());

        assertThat(response.getSummary()).isSameAs(summary);
        assertThat(response.getSeriesUsed()).isEqualTo(1);
    }

    @Test
    void slowTrainingIsCancelledAfterTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        when(model.train(anyList(), anyList(), anyDouble())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        });

        assertThatThrownBy(() -> service.trainUnivariate(TrainRequestDto.builder().values(values(30)).build()))
                .isInstanceOf(TrainingTimeoutException.class)
                .hasMessageContaining("'default'");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void failuresInsideTrainingSurfaceUnwrapped() {
        when(model.train(anyList(), anyList(), anyDouble()))
                .thenThrow(new InsufficientDataException("training 'default'", 10, 3));

        assertThatThrownBy(() -> service.trainUnivariate(TrainRequestDto.builder().values(values(30)).build()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void historyBelowMinimumIsRejectedBeforeTraining() {
        TrainingSet small = TrainingSet.builder()
                .vectors(vectors(20))
                .featureNames(List.of("value"))
                .assets(1)
                .seriesUsed(1)
                .build();
        when(historyTrainer.collect(eq(List.of("web-1")), eq("cpu"), any(), any(), anyInt())).thenReturn(small);

        assertThatThrownBy(() -> service.trainUnivariate(TrainRequestDto.builder()
                .assetIds(List.of("web-1"))
                .metricName("cpu")
                .build()))
                .isInstanceOf(InsufficientDataException.class);
        verify(model, never()).train(anyList(), anyList(), anyDouble());
    }

    @Test
    void historyTrainingUsesConfiguredLookback() {
        TrainingSet set = TrainingSet.builder()
                .vectors(vectors(60))
                .featureNames(List.of("value"))
                .assets(2)
                .seriesUsed(1)
                .failedAsset("web-2")
                .build();
        Instant end = CLOCK.instant();
        when(historyTrainer.collect(List.of("web-1", "web-2"), "cpu", end.minusSeconds(3600), end, 10_000)).thenReturn(set);
        when(model.train(anyList(), eq(List.of("value")), eq(0.05)))
                .thenReturn(TrainingSummary.builder().modelName("default").samples(60).build());

        TrainResponseDto response = service.trainUnivariate(TrainRequestDto.builder()
                .assetIds(List.of("web-1", "web-2"))
                .metricName("cpu")
                .contamination(0.05)
                .build());

        assertThat(response.getSummary().getSamples()).isEqualTo(60);
        assertThat(response.getFailedAssets()).containsExactly("web-2");
    }

    @Test
    void requestWithoutValuesOrAssetsIsRejected() {
        assertThatThrownBy(() -> service.trainUnivariate(new TrainRequestDto()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<Double> values(int n) {
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            values.add(50.0 + (i % 5));
        }
        return values;
    }

    private static List<FeatureVector> vectors(int n) {
        List<FeatureVector> vectors = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            vectors.add(FeatureVector.of(i));
        }
        return vectors;
    }
}
