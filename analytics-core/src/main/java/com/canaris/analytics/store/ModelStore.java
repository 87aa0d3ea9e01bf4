package com.canaris.analytics.store;

import com.canaris.analytics.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Versioned persistence of trained model state.
 * <p>
 * Every save writes a new immutable version and then moves the {@code latest}
 * alias to it. Readers resolving {@code latest} see either the previous or the
 * new version. Writes to the same model name are serialized.
 */
@Slf4j
public class ModelStore {

    public static final String LATEST = "latest";

    private final ModelStateRepository repository;
    private final VersionIdGenerator versionIds;
    private final Clock clock;
    private final ConcurrentMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

    public ModelStore(ModelStateRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.versionIds = new VersionIdGenerator(clock);
    }

    public ModelStore(ModelStateRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public ModelVersion save(String name, Serializable state, Map<String, Object> metadata) {
        byte[] bytes;
        try {
            bytes = ModelSerializer.toBytes(state);
        } catch (IOException e) {
            throw new PersistenceException(name, "new", "could not serialize model state", e);
        }

        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            String version = versionIds.next();
            Instant now = clock.instant();
            Map<String, Object> stored = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
            stored.put("savedAt", now.toString());
            stored.put("version", version);

            try {
                repository.insert(StoredModel.builder()
                        .name(name)
                        .version(version)
                        .state(bytes)
                        .metadata(stored)
                        .createdAt(now)
                        .build());
                repository.pointLatest(name, version);
            } catch (RuntimeException e) {
                throw new PersistenceException(name, version, "could not write model version", e);
            }
            log.info("Model saved: {} version {} ({} bytes)", name, version, bytes.length);
            return ModelVersion.builder()
                    .name(name)
                    .version(version)
                    .createdAt(now)
                    .sizeBytes(bytes.length)
                    .latest(true)
                    .metadata(stored)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param version a version id, or {@code "latest"} / {@code null} for the alias target
     * @return the model, or empty when nothing is stored under that name and version
     */
    public <T> Optional<LoadedModel<T>> load(String name, String version, Class<T> type) {
        Optional<StoredModel> found = find(name, version);
        if (found.isEmpty()) {
            log.info("No saved model found for '{}' ({})", name, version == null ? LATEST : version);
            return Optional.empty();
        }
        StoredModel model = found.get();
        Object state;
        try {
            state = ModelSerializer.fromBytes(model.getState());
        } catch (IOException | ClassNotFoundException e) {
            throw new PersistenceException(name, model.getVersion(), "could not deserialize model state", e);
        }
        if (!type.isInstance(state)) {
            throw new PersistenceException(name, model.getVersion(),
                    "stored state is a " + state.getClass().getName() + ", expected " + type.getName(), null);
        }
        log.info("Model loaded: {} version {}", name, model.getVersion());
        return Optional.of(new LoadedModel<>(name, model.getVersion(), type.cast(state), model.getMetadata(), model.getCreatedAt()));
    }

    public Optional<Map<String, Object>> loadMetadata(String name, String version) {
        return find(name, version).map(StoredModel::getMetadata);
    }

    public Optional<String> latestVersion(String name) {
        return repository.findLatestVersion(name);
    }

    public List<ModelVersion> listVersions(String name) {
        return repository.listVersions(name);
    }

    /** The newest version of every stored model. */
    public List<ModelVersion> listModels() {
        List<ModelVersion> models = new ArrayList<>();
        for (String name : repository.listModelNames()) {
            List<ModelVersion> versions = repository.listVersions(name);
            versions.stream().filter(ModelVersion::isLatest).findFirst()
                    .or(() -> versions.stream().findFirst())
                    .ifPresent(models::add);
        }
        return models;
    }

    public StorageStats storageStats() {
        int models = 0;
        int versions = 0;
        long bytes = 0;
        for (String name : repository.listModelNames()) {
            models++;
            for (ModelVersion version : repository.listVersions(name)) {
                versions++;
                bytes += version.getSizeBytes();
            }
        }
        return StorageStats.builder().totalModels(models).totalVersions(versions).totalSizeBytes(bytes).build();
    }

    /**
     * Deletes one version. When it was the {@code latest} target the alias moves
     * to the next most recent remaining version, or is cleared if none remain.
     *
     * @return {@code false} if the version did not exist
     */
    public boolean deleteVersion(String name, String version) {
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            boolean wasLatest = repository.findLatestVersion(name).map(version::equals).orElse(false);
            boolean deleted;
            try {
                deleted = repository.deleteVersion(name, version);
                if (deleted && wasLatest) {
                    Optional<ModelVersion> next = repository.listVersions(name).stream().findFirst();
                    if (next.isPresent()) {
                        repository.pointLatest(name, next.get().getVersion());
                        log.info("Latest alias of {} moved to {}", name, next.get().getVersion());
                    } else {
                        repository.clearLatest(name);
                        log.info("Latest alias of {} cleared, no versions remain", name);
                    }
                }
            } catch (RuntimeException e) {
                throw new PersistenceException(name, version, "could not delete model version", e);
            }
            if (deleted) {
                log.info("Deleted model: {} version {}", name, version);
            }
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    private Optional<StoredModel> find(String name, String version) {
        try {
            if (version == null || LATEST.equals(version)) {
                return repository.findLatestVersion(name).flatMap(v -> repository.findVersion(name, v));
            }
            return repository.findVersion(name, version);
        } catch (RuntimeException e) {
            throw new PersistenceException(name, version == null ? LATEST : version, "could not read model version", e);
        }
    }

    private ReentrantLock lockFor(String name) {
        return writeLocks.computeIfAbsent(name, k -> new ReentrantLock());
    }
}
