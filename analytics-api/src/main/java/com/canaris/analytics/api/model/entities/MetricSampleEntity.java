package com.canaris.analytics.api.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "t_metric_sample", schema = "public",
        indexes = @Index(name = "ix_metric_sample_asset_ts", columnList = "asset_id, ts_utc"))
public class MetricSampleEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "metric_sample_entity_seq_generator")
    @SequenceGenerator(name = "metric_sample_entity_seq_generator", sequenceName = "metric_sample_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "asset_id", nullable = false, length = 64)
    private String assetId;

    @Column(name = "metric_name", nullable = false, length = 64)
    private String metricName;

    @Column(name = "ts_utc", nullable = false)
    private Instant tsUtc;

    @Column(name = "metric_value", nullable = false)
    private Double metricValue;

}
