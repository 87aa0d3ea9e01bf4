package com.canaris.analytics.analysis;

import com.canaris.analytics.exception.UpstreamFetchException;
import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.source.MetricSample;
import com.canaris.analytics.source.MetricSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.canaris.analytics.analysis.BatchAnalyzerTest.flatWithSpike;
import static com.canaris.analytics.analysis.BatchAnalyzerTest.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryTrainerTest {

    @Mock
    private MetricSource source;

    @Test
    void concatenatesVectorsOfEverySeriesAboveTheFloor() {
        List<MetricSample> first = new ArrayList<>(series("a", "cpu", flatWithSpike(15, 50, 50)));
        first.addAll(series("a", "mem", flatWithSpike(12, 10, 10)));
        first.addAll(series("a", "disk", 1, 2));
        when(source.fetch(eq("a"), isNull(), any(), any(), eq(100))).thenReturn(first);
        when(source.fetch(eq("b"), isNull(), any(), any(), eq(100)))
                .thenThrow(new UpstreamFetchException("b", "timeout", null));
        when(source.fetch(eq("c"), isNull(), any(), any(), eq(100)))
                .thenReturn(series("c", "cpu", flatWithSpike(20, 40, 40)));
        HistoryTrainer trainer = new HistoryTrainer(source, new FeatureEngineer(), Runnable::run);

        TrainingSet set = trainer.collect(List.of("a", "b", "c"), null, Instant.EPOCH, Instant.EPOCH, 100);

        assertThat(set.size()).isEqualTo(15 + 12 + 20);
        assertThat(set.getSeriesUsed()).isEqualTo(3);
        assertThat(set.getSeriesSkipped()).isEqualTo(1);
        assertThat(set.getFailedAssets()).containsExactly("b");
        assertThat(set.getFeatureNames()).hasSize(6);
        assertThat(set.getVectors()).allSatisfy(v -> assertThat(v.length()).isEqualTo(6));
    }
}
