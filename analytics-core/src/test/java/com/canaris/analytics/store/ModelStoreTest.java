package com.canaris.analytics.store;

import com.canaris.analytics.exception.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ModelStoreTest {

    private ModelStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        store = new ModelStore(new InMemoryModelStateRepository(), clock);
    }

    @Test
    void saveThenLoadLatestReturnsState() {
        ModelVersion saved = store.save("cpu", new ArrayList<>(List.of(1, 2, 3)), Map.of("owner", "ops"));

        Optional<LoadedModel<ArrayList>> loaded = store.load("cpu", "latest", ArrayList.class);

        assertThat(loaded).isPresent();
        assertThat(loaded.get().getState()).containsExactly(1, 2, 3);
        assertThat(loaded.get().getVersion()).isEqualTo(saved.getVersion()).isEqualTo("20240101_000000_000");
        assertThat(loaded.get().getMetadata())
                .containsEntry("owner", "ops")
                .containsEntry("version", saved.getVersion())
                .containsKey("savedAt");
    }

    @Test
    void eachSaveCreatesNewVersionAndMovesLatest() {
        ModelVersion v1 = store.save("cpu", "first", Map.of());
        ModelVersion v2 = store.save("cpu", "second", Map.of());

        assertThat(v2.getVersion()).isGreaterThan(v1.getVersion());
        assertThat(store.latestVersion("cpu")).contains(v2.getVersion());
        assertThat(store.load("cpu", v1.getVersion(), String.class).map(LoadedModel::getState)).contains("first");
        assertThat(store.load("cpu", null, String.class).map(LoadedModel::getState)).contains("second");
        assertThat(store.listVersions("cpu")).extracting(ModelVersion::getVersion)
                .containsExactly(v2.getVersion(), v1.getVersion());
        assertThat(store.listVersions("cpu")).extracting(ModelVersion::isLatest).containsExactly(true, false);
    }

    @Test
    void unknownModelOrVersionIsEmpty() {
        assertThat(store.load("nothing", "latest", String.class)).isEmpty();
        store.save("cpu", "first", Map.of());
        assertThat(store.load("cpu", "19990101_000000_000", String.class)).isEmpty();
        assertThat(store.loadMetadata("cpu", "19990101_000000_000")).isEmpty();
    }

    @Test
    void deletingLatestRepointsToPreviousVersion() {
        ModelVersion v1 = store.save("cpu", "first", Map.of());
        ModelVersion v2 = store.save("cpu", "second", Map.of());

        assertThat(store.deleteVersion("cpu", v2.getVersion())).isTrue();

        assertThat(store.latestVersion("cpu")).contains(v1.getVersion());
        assertThat(store.load("cpu", "latest", String.class).map(LoadedModel::getState)).contains("first");
    }

    @Test
    void deletingOlderVersionKeepsLatest() {
        ModelVersion v1 = store.save("cpu", "first", Map.of());
        ModelVersion v2 = store.save("cpu", "second", Map.of());

        store.deleteVersion("cpu", v1.getVersion());

        assertThat(store.latestVersion("cpu")).contains(v2.getVersion());
        assertThat(store.listVersions("cpu")).hasSize(1);
    }

    @Test
    void deletingLastVersionClearsLatest() {
        ModelVersion v1 = store.save("cpu", "first", Map.of());

        store.deleteVersion("cpu", v1.getVersion());

        assertThat(store.latestVersion("cpu")).isEmpty();
        assertThat(store.load("cpu", "latest", String.class)).isEmpty();
        assertThat(store.deleteVersion("cpu", v1.getVersion())).isFalse();
        assertThat(store.listModels()).isEmpty();
    }

    @Test
    void listsModelsAndStorageStats() {
        store.save("cpu", "a", Map.of());
        store.save("cpu", "b", Map.of());
        store.save("mem", "c", Map.of());

        assertThat(store.listModels()).extracting(ModelVersion::getName).containsExactly("cpu", "mem");
        assertThat(store.listModels()).allMatch(ModelVersion::isLatest);

        StorageStats stats = store.storageStats();
        assertThat(stats.getTotalModels()).isEqualTo(2);
        assertThat(stats.getTotalVersions()).isEqualTo(3);
        assertThat(stats.getTotalSizeBytes()).isPositive();
    }

    @Test
    void wrongStateTypeIsPersistenceFailure() {
        store.save("cpu", "text", Map.of());

        assertThatThrownBy(() -> store.load("cpu", "latest", Integer.class))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void unserializableStateIsPersistenceFailure() {
        Serializable holder = new Holder(new Object());

        assertThatThrownBy(() -> store.save("cpu", holder, Map.of()))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("cpu");
        assertThat(store.listVersions("cpu")).isEmpty();
    }

    @Test
    void repositoryFailureIsWrapped() {
        ModelStateRepository repository = mock(ModelStateRepository.class);
        doThrow(new IllegalStateException("disk full")).when(repository).insert(any());
        ModelStore failing = new ModelStore(repository);

        assertThatThrownBy(() -> failing.save("cpu", "state", Map.of()))
                .isInstanceOf(PersistenceException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void readersOnlyEverSeeCompleteSavedVersions() throws Exception {
        int saves = 150;
        int width = 500;
        int readers = 3;
        Map<String, Integer> savedVersions = new ConcurrentHashMap<>();
        savedVersions.put(store.save("cpu", filled(-1, width), Map.of()).getVersion(), -1);

        ExecutorService pool = Executors.newFixedThreadPool(readers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            Future<?> writer = pool.submit(() -> {
                start.await();
                try {
                    for (int i = 0; i < saves; i++) {
                        savedVersions.put(store.save("cpu", filled(i, width), Map.of()).getVersion(), i);
                    }
                } finally {
                    writing.set(false);
                }
                return null;
            });
            List<Future<List<LoadedModel<ArrayList>>>> observed = new ArrayList<>();
            for (int r = 0; r < readers; r++) {
                observed.add(pool.submit(() -> {
                    start.await();
                    List<LoadedModel<ArrayList>> seen = new ArrayList<>();
                    while (writing.get()) {
                        seen.add(store.load("cpu", ModelStore.LATEST, ArrayList.class).orElseThrow());
                    }
                    return seen;
                }));
            }
            start.countDown();
            writer.get(30, TimeUnit.SECONDS);

            for (Future<List<LoadedModel<ArrayList>>> reader : observed) {
                String previous = "";
                for (LoadedModel<ArrayList> model : reader.get(30, TimeUnit.SECONDS)) {
                    assertThat(savedVersions).containsKey(model.getVersion());
                    assertThat(model.getVersion()).isGreaterThanOrEqualTo(previous);
                    assertThat(model.getState()).hasSize(width).containsOnly(savedVersions.get(model.getVersion()));
                    assertThat(model.getMetadata()).containsEntry("version", model.getVersion());
                    previous = model.getVersion();
                }
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.listVersions("cpu")).hasSize(saves + 1);
        assertThat(store.load("cpu", ModelStore.LATEST, ArrayList.class).orElseThrow().getState())
                .containsOnly(saves - 1);
    }

    private static ArrayList<Integer> filled(int value, int width) {
        ArrayList<Integer> state = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            state.add(value);
        }
        return state;
    }

    private static final class Holder implements Serializable {
        private final Object payload;

        Holder(Object payload) {
            this.payload = payload;
        }
    }
}
