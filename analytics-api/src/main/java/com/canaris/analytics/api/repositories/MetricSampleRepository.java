package com.canaris.analytics.api.repositories;

import com.canaris.analytics.api.model.entities.MetricSampleEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface MetricSampleRepository extends JpaRepository<MetricSampleEntity, Long> {

    List<MetricSampleEntity> findAllByAssetIdAndTsUtcBetweenOrderByTsUtcDesc(String assetId, Instant start, Instant end,
                                                                           Pageable pageable);

    List<MetricSampleEntity> findAllByAssetIdAndMetricNameAndTsUtcBetweenOrderByTsUtcDesc(String assetId, String metricName,
                                                                                         Instant start, Instant end,
                                                                                         Pageable pageable);
}
