package com.canaris.analytics.api.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "t_model_version", schema = "public",
        uniqueConstraints = @UniqueConstraint(name = "uk_model_version", columnNames = {"model_name", "version"}))
public class ModelVersionEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "model_version_entity_seq_generator")
    @SequenceGenerator(name = "model_version_entity_seq_generator", sequenceName = "model_version_id_seq", allocationSize = 50)
    private Long id;

    @Column(name = "model_name", nullable = false, length = 128)
    private String modelName;

    @Column(name = "version", nullable = false, length = 32)
    private String version;

    @Column(name = "size_bytes", nullable = false)
    private Long sizeBytes;

    @Column(name = "metadata", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "model_bytes", nullable = false, length = 64 * 1024 * 1024)
    private byte[] modelBytes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    public void setCreatedAt() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

}
