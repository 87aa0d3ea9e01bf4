package com.canaris.analytics.api.services;

import com.canaris.analytics.api.model.entities.ModelAliasEntity;
import com.canaris.analytics.api.model.entities.ModelVersionEntity;
import com.canaris.analytics.api.repositories.ModelAliasRepository;
import com.canaris.analytics.api.repositories.ModelVersionRepository;
import com.canaris.analytics.store.ModelStateRepository;
import com.canaris.analytics.store.ModelVersion;
import com.canaris.analytics.store.StoredModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores model versions in {@code t_model_version} and the {@code latest}
 * pointers in {@code t_model_alias}. Moving a pointer is a single-row update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaModelStateRepository implements ModelStateRepository {

    private final ModelVersionRepository modelVersionRepository;
    private final ModelAliasRepository modelAliasRepository;

    @Override
    @Transactional
    public void insert(StoredModel model) {
        ModelVersionEntity entity = new ModelVersionEntity();
        entity.setModelName(model.getName());
        entity.setVersion(model.getVersion());
        entity.setModelBytes(model.getState());
        entity.setSizeBytes((long) model.getState().length);
        entity.setMetadata(new LinkedHashMap<>(model.getMetadata()));
        entity.setCreatedAt(model.getCreatedAt());
        modelVersionRepository.save(entity);
        log.debug("Inserted model {} version {} ({} bytes)", model.getName(), model.getVersion(), model.getState().length);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredModel> findVersion(String name, String version) {
        return modelVersionRepository.findByModelNameAndVersion(name, version)
                .map(e -> StoredModel.builder()
                        .name(e.getModelName())
                        .version(e.getVersion())
                        .state(e.getModelBytes())
                        .metadata(e.getMetadata())
                        .createdAt(e.getCreatedAt())
                        .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findLatestVersion(String name) {
        return modelAliasRepository.findById(name).map(ModelAliasEntity::getVersion);
    }

    @Override
    @Transactional
    public void pointLatest(String name, String version) {
        ModelAliasEntity alias = modelAliasRepository.findById(name).orElseGet(() -> {
            ModelAliasEntity created = new ModelAliasEntity();
            created.setModelName(name);
            return created;
        });
        alias.setVersion(version);
        modelAliasRepository.save(alias);
    }

    @Override
    @Transactional
    public void clearLatest(String name) {
        modelAliasRepository.findById(name).ifPresent(modelAliasRepository::delete);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ModelVersion> listVersions(String name) {
        String latest = findLatestVersion(name).orElse(null);
        return modelVersionRepository.findAllByModelNameOrderByVersionDesc(name).stream()
                .map(v -> ModelVersion.builder()
                        .name(v.getModelName())
                        .version(v.getVersion())
                        .createdAt(v.getCreatedAt())
                        .sizeBytes(v.getSizeBytes())
                        .latest(v.getVersion().equals(latest))
                        .metadata(v.getMetadata())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> listModelNames() {
        return modelVersionRepository.findModelNames();
    }

    @Override
    @Transactional
    public boolean deleteVersion(String name, String version) {
        return modelVersionRepository.deleteByModelNameAndVersion(name, version) > 0;
    }
}
