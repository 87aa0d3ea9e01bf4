package com.canaris.analytics.api.services;

import com.canaris.analytics.exception.ModelVersionNotFoundException;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.ModelInfo;
import com.canaris.analytics.model.MultivariateModel;
import com.canaris.analytics.store.ModelStore;
import com.canaris.analytics.store.ModelVersion;
import com.canaris.analytics.store.StorageStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelCatalogService {

    private final ModelStore store;
    private final DetectorRegistry registry;

    /** Latest version of every stored model. */
    public List<ModelVersion> listModels() {
        return store.listModels();
    }

    public StorageStats stats() {
        return store.storageStats();
    }

    public ModelVersion latest(String name) {
        String version = store.latestVersion(name)
                .orElseThrow(() -> new ModelVersionNotFoundException(name, ModelStore.LATEST));
        return store.listVersions(name).stream()
                .filter(v -> v.getVersion().equals(version))
                .findFirst()
                .orElseThrow(() -> new ModelVersionNotFoundException(name, version));
    }

    public List<ModelVersion> versions(String name) {
        return store.listVersions(name);
    }

    /**
     * Detector view of the latest version. The stored {@code type} metadata
     * decides which detector reads it.
     */
    public ModelInfo info(String name) {
        Map<String, Object> metadata = store.loadMetadata(name, ModelStore.LATEST)
                .orElseThrow(() -> new ModelVersionNotFoundException(name, ModelStore.LATEST));
        if (MultivariateModel.TYPE.equals(metadata.get("type"))) {
            return registry.multivariate(name).info();
        }
        return registry.univariate(name).info();
    }

    public void deleteVersion(String name, String version) {
        if (!store.deleteVersion(name, version)) {
            throw new ModelVersionNotFoundException(name, version);
        }
        registry.reload(name);
    }

    public ModelVersion reload(String name) {
        log.info("Reloading detectors for '{}'", name);
        registry.reload(name);
        return latest(name);
    }
}
