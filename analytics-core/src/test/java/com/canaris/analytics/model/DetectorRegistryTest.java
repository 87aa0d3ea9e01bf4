package com.canaris.analytics.model;

import com.canaris.analytics.features.FeatureEngineer;
import com.canaris.analytics.forest.ForestOptions;
import com.canaris.analytics.store.InMemoryModelStateRepository;
import com.canaris.analytics.store.ModelStore;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorRegistryTest {

    private final ModelStore store = new ModelStore(new InMemoryModelStateRepository());
    private final DetectorRegistry registry = new DetectorRegistry(store,
            DetectorConfig.builder().forest(ForestOptions.builder().trees(20).build()).build());

    private final double[] series = IntStream.range(0, 40).mapToDouble(i -> 10 + (i % 7)).toArray();

    @Test
    void returnsSameDetectorPerName() {
        assertThat(registry.univariate("cpu")).isSameAs(registry.univariate("cpu"));
        assertThat(registry.univariate("cpu")).isNotSameAs(registry.univariate("mem"));
        assertThat(registry.cachedNames()).containsExactly("cpu", "mem");
    }

    @Test
    void reloadPicksUpVersionsSavedElsewhere() {
        UnivariateModel cached = registry.univariate("cpu");
        assertThat(cached.isTrained()).isFalse();

        new UnivariateModel("cpu", store, registry.getConfig()).train(new FeatureEngineer().transform(series));
        registry.reload("cpu");

        assertThat(cached.isTrained()).isTrue();
    }

    @Test
    void evictedDetectorIsRecreatedFromStore() {
        UnivariateModel first = registry.univariate("cpu");
        first.train(new FeatureEngineer().transform(series));

        registry.evict("cpu");
        UnivariateModel second = registry.univariate("cpu");

        assertThat(second).isNotSameAs(first);
        assertThat(second.isTrained()).isTrue();
        assertThat(second.getVersion()).isEqualTo(first.getVersion());
    }
}
