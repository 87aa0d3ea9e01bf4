package com.canaris.analytics.api.repositories;

import com.canaris.analytics.api.model.entities.ModelVersionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public interface ModelVersionRepository extends JpaRepository<ModelVersionEntity, Long> {

    Optional<ModelVersionEntity> findByModelNameAndVersion(String modelName, String version);

    /** Version rows without their state bytes, newest first. */
    List<VersionSummary> findAllByModelNameOrderByVersionDesc(String modelName);

    @Query("SELECT DISTINCT e.modelName FROM ModelVersionEntity e ORDER BY e.modelName")
    List<String> findModelNames();

    long deleteByModelNameAndVersion(String modelName, String version);

    interface VersionSummary {
        String getModelName();

        String getVersion();

        Long getSizeBytes();

        Map<String, Object> getMetadata();

        Instant getCreatedAt();
    }
}
