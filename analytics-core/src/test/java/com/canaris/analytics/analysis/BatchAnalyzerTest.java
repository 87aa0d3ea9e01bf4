package com.canaris.analytics.analysis;

import com.canaris.analytics.exception.UpstreamFetchException;
import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.forest.ForestOptions;
import com.canaris.analytics.model.DetectionMethod;
import com.canaris.analytics.model.DetectorConfig;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.source.MetricSample;
import com.canaris.analytics.source.MetricSource;
import com.canaris.analytics.statistics.StatisticalScorer;
import com.canaris.analytics.store.InMemoryModelStateRepository;
import com.canaris.analytics.store.ModelStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchAnalyzerTest {

    private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

    @Mock
    private MetricSource source;

    private DetectorRegistry detectors;
    private AssetAnalyzer assetAnalyzer;
    private BatchAnalyzer batchAnalyzer;

    @BeforeEach
    void setUp() {
        detectors = new DetectorRegistry(new ModelStore(new InMemoryModelStateRepository()),
                DetectorConfig.builder().forest(ForestOptions.builder().trees(30).build()).build());
        assetAnalyzer = new AssetAnalyzer(source, new FeatureEngineer(), new StatisticalScorer(), detectors);
        batchAnalyzer = new BatchAnalyzer(assetAnalyzer, 2);
    }

    @AfterEach
    void tearDown() {
        batchAnalyzer.close();
    }

    static List<MetricSample> series(String asset, String metric, double... values) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(MetricSample.builder()
                    .assetId(asset)
                    .metricName(metric)
                    .timestamp(START.plusSeconds(60L * i))
                    .value(values[i])
                    .build());
        }
        return samples;
    }

    static double[] flatWithSpike(int n, double level, double spike) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = level + (i % 2);
        }
        values[n - 1] = spike;
        return values;
    }

    private static AnalysisRequest request() {
        return AnalysisRequest.builder().start(START).end(START.plusSeconds(3600)).modelName("default").build();
    }

    @Test
    void untrainedModelFallsBackToZScore() {
        List<MetricSample> samples = series("host-1", "cpu", flatWithSpike(20, 50, 500));
        Collections.reverse(samples);
        when(source.fetch(eq("host-1"), isNull(), any(), any(), anyInt())).thenReturn(samples);

        AssetAnalysisResult result = assetAnalyzer.analyze("host-1", request());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSeriesAnalyzed()).isEqualTo(1);
        assertThat(result.getFindings()).singleElement().satisfies(f -> {
            assertThat(f.getMetricName()).isEqualTo("cpu");
            assertThat(f.getValue()).isEqualTo(500);
            assertThat(f.getTimestamp()).isEqualTo(START.plusSeconds(60L * 19));
            assertThat(f.getMethod()).isEqualTo(DetectionMethod.STATISTICAL);
        });
    }

    @Test
    void trainedModelIsUsedWhenAvailable() {
        FeatureEngineer engineer = new FeatureEngineer();
        detectors.univariate("default").train(engineer.transform(flatWithSpike(200, 50, 51)));
        when(source.fetch(eq("host-1"), isNull(), any(), any(), anyInt()))
                .thenReturn(series("host-1", "cpu", flatWithSpike(30, 50, 400)));

        AssetAnalysisResult result = assetAnalyzer.analyze("host-1", request());

        assertThat(result.getFindings()).isNotEmpty()
                .allSatisfy(f -> assertThat(f.getMethod()).isEqualTo(DetectionMethod.ML));
        assertThat(result.getFindings()).anySatisfy(f -> assertThat(f.getValue()).isEqualTo(400));
    }

    @Test
    void shortSeriesAreSkipped() {
        List<MetricSample> samples = new ArrayList<>(series("host-1", "cpu", flatWithSpike(20, 50, 500)));
        samples.addAll(series("host-1", "disk", 1, 2, 3));
        when(source.fetch(eq("host-1"), isNull(), any(), any(), anyInt())).thenReturn(samples);

        AssetAnalysisResult result = assetAnalyzer.analyze("host-1", request());

        assertThat(result.getSeriesAnalyzed()).isEqualTo(1);
        assertThat(result.getSeriesSkipped()).isEqualTo(1);
        assertThat(result.getPointsAnalyzed()).isEqualTo(20);
    }

    @Test
    void namedMetricsAreFetchedOneByOne() {
        when(source.fetch(eq("host-1"), eq("cpu"), any(), any(), eq(500)))
                .thenReturn(series("host-1", "cpu", flatWithSpike(20, 50, 500)));
        when(source.fetch(eq("host-1"), eq("mem"), any(), any(), eq(500)))
                .thenReturn(series("host-1", "mem", flatWithSpike(20, 10, 10)));
        AnalysisRequest request = AnalysisRequest.builder()
                .metricName("cpu").metricName("mem").limit(500).useMl(false).start(START).end(START).build();

        AssetAnalysisResult result = assetAnalyzer.analyze("host-1", request);

        assertThat(result.getSeriesAnalyzed()).isEqualTo(2);
        assertThat(result.getFindings()).extracting(AnomalyFinding::getMetricName).containsExactly("cpu");
        verify(source).fetch(eq("host-1"), eq("mem"), any(), any(), eq(500));
    }

    @Test
    void emptyHistoryIsASuccessWithoutFindings() {
        when(source.fetch(eq("idle"), isNull(), any(), any(), anyInt())).thenReturn(List.of());

        AssetAnalysisResult result = assetAnalyzer.analyze("idle", request());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFindings()).isEmpty();
    }

    @Test
    void failingAssetDoesNotAbortBatch() {
        when(source.fetch(eq("good"), isNull(), any(), any(), anyInt()))
                .thenReturn(series("good", "cpu", flatWithSpike(20, 50, 500)));
        when(source.fetch(eq("bad"), isNull(), any(), any(), anyInt()))
                .thenThrow(new UpstreamFetchException("bad", "connection refused", null));
        when(source.fetch(eq("quiet"), isNull(), any(), any(), anyInt())).thenReturn(List.of());

        BatchAnalysisResult batch = batchAnalyzer.analyze(List.of("good", "bad", "quiet"), request());

        assertThat(batch.getTotalAssets()).isEqualTo(3);
        assertThat(batch.getSuccessful()).isEqualTo(2);
        assertThat(batch.getFailed()).isEqualTo(1);
        assertThat(batch.getTotalAnomalies()).isEqualTo(1);
        assertThat(batch.getResults()).extracting(AssetAnalysisResult::getAssetId).containsExactly("good", "bad", "quiet");
        assertThat(batch.getResults().get(1).isSuccess()).isFalse();
        assertThat(batch.getResults().get(1).getError()).contains("connection refused");
    }

    @Test
    void namedThreadsAreNumberedDaemons() {
        ThreadFactory factory = BatchAnalyzer.namedThreads("history-fetch");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertThat(first.getName()).isEqualTo("history-fetch-1");
        assertThat(second.getName()).isEqualTo("history-fetch-2");
        assertThat(first.isDaemon()).isTrue();
    }
}
