package com.canaris.analytics.api.repositories;

import com.canaris.analytics.api.model.entities.ModelAliasEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ModelAliasRepository extends JpaRepository<ModelAliasEntity, String> {
}
