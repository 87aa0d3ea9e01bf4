package com.canaris.analytics.api.services;

import com.canaris.analytics.api.model.entities.MetricSampleEntity;
import com.canaris.analytics.api.repositories.MetricSampleRepository;
import com.canaris.analytics.exception.UpstreamFetchException;
import com.canaris.analytics.source.MetricSample;
import com.canaris.analytics.source.MetricSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads metric history from {@code t_metric_sample}. When more than
 * {@code limit} samples fall in the window the most recent ones are returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaMetricSource implements MetricSource {

    private final MetricSampleRepository metricSampleRepository;

    @Override
    @Transactional(readOnly = true)
    public List<MetricSample> fetch(String assetId, String metricName, Instant start, Instant end, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        List<MetricSampleEntity> rows;
        try {
            rows = metricName == null
                    ? metricSampleRepository.findAllByAssetIdAndTsUtcBetweenOrderByTsUtcDesc(assetId, start, end, page)
                    : metricSampleRepository.findAllByAssetIdAndMetricNameAndTsUtcBetweenOrderByTsUtcDesc(
                            assetId, metricName, start, end, page);
        } catch (DataAccessException e) {
            throw new UpstreamFetchException(assetId, e.getMessage(), e);
        }
        log.debug("Fetched {} samples for asset {} metric {} between {} and {}", rows.size(), assetId, metricName, start, end);
        return rows.stream()
                .map(row -> MetricSample.builder()
                        .assetId(row.getAssetId())
                        .metricName(row.getMetricName())
                        .timestamp(row.getTsUtc())
                        .value(row.getMetricValue())
                        .build())
                .collect(Collectors.toList());
    }
}
