package com.canaris.analytics.api.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * The {@code latest} pointer of one model name.
 */
@Getter
@Setter
@Entity
@Table(name = "t_model_alias", schema = "public")
public class ModelAliasEntity {

    @Id
    @Column(name = "model_name", nullable = false, length = 128)
    private String modelName;

    @Column(name = "version", nullable = false, length = 32)
    private String version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    public void setUpdatedAt() {
        this.updatedAt = Instant.now();
    }

}
