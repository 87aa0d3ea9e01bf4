package com.canaris.analytics.api.services;

import com.canaris.analytics.store.LoadedModel;
import com.canaris.analytics.store.ModelStore;
import com.canaris.analytics.store.ModelVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaModelStateRepository.class)
class JpaModelStateRepositoryTest {

    @Autowired
    private JpaModelStateRepository repository;

    private ModelStore store;

    @BeforeEach
    void setUp() {
        store = new ModelStore(repository);
    }

    @Test
    void saveThenLoadLatestReturnsTheSameState() {
        ArrayList<Double> state = new ArrayList<>(List.of(1.0, 2.0, 3.0));
        ModelVersion saved = store.save("cpu", state, Map.of("contamination", 0.1));

        Optional<LoadedModel<ArrayList>> loaded = store.load("cpu", ModelStore.LATEST, ArrayList.class);

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getState()).containsExactly(1.0, 2.0, 3.0);
        assertThat(loaded.get().getVersion()).isEqualTo(saved.getVersion());
        assertThat(store.loadMetadata("cpu", saved.getVersion()).orElseThrow())
                .containsEntry("contamination", 0.1)
                .containsEntry("version", saved.getVersion());
    }

    @Test
    void newestVersionBecomesLatest() {
        ModelVersion first = store.save("cpu", "a", Map.of());
        ModelVersion second = store.save("cpu", "b", Map.of());

        assertThat(store.latestVersion("cpu")).contains(second.getVersion());
        List<ModelVersion> versions = store.listVersions("cpu");
        assertThat(versions).extracting(ModelVersion::getVersion)
                .containsExactly(second.getVersion(), first.getVersion());
        assertThat(versions).extracting(ModelVersion::isLatest).containsExactly(true, false);
    }

    @Test
    void deletingLatestMovesAliasToPreviousVersion() {
        ModelVersion first = store.save("cpu", "a", Map.of());
        ModelVersion second = store.save("cpu", "b", Map.of());

        assertThat(store.deleteVersion("cpu", second.getVersion())).isTrue();

        assertThat(store.latestVersion("cpu")).contains(first.getVersion());
        assertThat(store.load("cpu", null, String.class).orElseThrow().getState()).isEqualTo("a");
    }

    @Test
    void deletingLastVersionClearsAlias() {
        ModelVersion only = store.save("cpu", "a", Map.of());

        assertThat(store.deleteVersion("cpu", only.getVersion())).isTrue();

        assertThat(store.latestVersion("cpu")).isEmpty();
        assertThat(store.load("cpu", ModelStore.LATEST, String.class)).isEmpty();
    }

    @Test
    void deletingUnknownVersionReportsFalse() {
        store.save("cpu", "a", Map.of());

        assertThat(store.deleteVersion("cpu", "19990101_000000_000")).isFalse();
        assertThat(store.listVersions("cpu")).hasSize(1);
    }

    @Test
    void statsCoverEveryModel() {
        store.save("cpu", "a", Map.of());
        store.save("cpu", "b", Map.of());
        store.save("memory", "c", Map.of());

        assertThat(store.listModels()).extracting(ModelVersion::getName).containsExactlyInAnyOrder("cpu", "memory");
        assertThat(store.storageStats().getTotalModels()).isEqualTo(2);
        assertThat(store.storageStats().getTotalVersions()).isEqualTo(3);
        assertThat(store.storageStats().getTotalSizeBytes()).isPositive();
    }
}
