package com.canaris.analytics.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed {@link ModelStateRepository} for tests and single-node use.
 */
public class InMemoryModelStateRepository implements ModelStateRepository {

    private final ConcurrentMap<String, ConcurrentSkipListMap<String, StoredModel>> versions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> latest = new ConcurrentHashMap<>();

    @Override
    public void insert(StoredModel model) {
        StoredModel copy = StoredModel.builder()
                .name(model.getName())
                .version(model.getVersion())
                .state(model.getState().clone())
                .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(model.getMetadata())))
                .createdAt(model.getCreatedAt())
                .build();
        StoredModel previous = versions.computeIfAbsent(model.getName(), k -> new ConcurrentSkipListMap<>())
                .putIfAbsent(model.getVersion(), copy);
        if (previous != null) {
            throw new IllegalStateException("Version " + model.getVersion() + " of " + model.getName() + " already exists");
        }
    }

    @Override
    public Optional<StoredModel> findVersion(String name, String version) {
        Map<String, StoredModel> byVersion = versions.get(name);
        return byVersion == null ? Optional.empty() : Optional.ofNullable(byVersion.get(version));
    }

    @Override
    public Optional<String> findLatestVersion(String name) {
        return Optional.ofNullable(latest.get(name));
    }

    @Override
    public void pointLatest(String name, String version) {
        latest.put(name, version);
    }

    @Override
    public void clearLatest(String name) {
        latest.remove(name);
    }

    @Override
    public List<ModelVersion> listVersions(String name) {
        Map<String, StoredModel> byVersion = versions.getOrDefault(name, new ConcurrentSkipListMap<>());
        String alias = latest.get(name);
        List<ModelVersion> result = new ArrayList<>();
        for (StoredModel model : byVersion.values()) {
            result.add(ModelVersion.builder()
                    .name(model.getName())
                    .version(model.getVersion())
                    .createdAt(model.getCreatedAt())
                    .sizeBytes(model.getState().length)
                    .latest(model.getVersion().equals(alias))
                    .metadata(model.getMetadata())
                    .build());
        }
        result.sort(Comparator.comparing(ModelVersion::getVersion).reversed());
        return result;
    }

    @Override
    public List<String> listModelNames() {
        List<String> names = new ArrayList<>();
        versions.forEach((name, byVersion) -> {
            if (!byVersion.isEmpty()) {
                names.add(name);
            }
        });
        Collections.sort(names);
        return names;
    }

    @Override
    public boolean deleteVersion(String name, String version) {
        Map<String, StoredModel> byVersion = versions.get(name);
        return byVersion != null && byVersion.remove(version) != null;
    }
}
