package com.canaris.analytics.api.services;

import com.canaris.analytics.api.dto.BusinessImpactRequestDto;
import com.canaris.analytics.api.dto.EventDto;
import com.canaris.analytics.api.dto.RootCauseRequestDto;
import com.canaris.analytics.correlation.Severity;
import com.canaris.analytics.rootcause.BusinessImpact;
import com.canaris.analytics.rootcause.EventRecord;
import com.canaris.analytics.rootcause.RootCauseAnalysis;
import com.canaris.analytics.rootcause.RootCauseRanker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RootCauseService {

    private static final int DEFAULT_ASSET_TIER = 3;

    private final RootCauseRanker ranker;

    public RootCauseAnalysis analyze(RootCauseRequestDto request) {
        List<EventRecord> related = Conversions.orEmpty(request.getRelatedEvents()).stream()
                .map(RootCauseService::toRecord)
                .toList();
        return ranker.analyze(toRecord(request.getEvent()), related, Conversions.toArrays(request.getAssetMetrics()));
    }

    public BusinessImpact businessImpact(BusinessImpactRequestDto request) {
        return ranker.calculateBusinessImpact(Severity.parse(request.getSeverity()),
                request.getAssetTier() != null ? request.getAssetTier() : DEFAULT_ASSET_TIER,
                request.getRelatedEventsCount());
    }

    private static EventRecord toRecord(EventDto event) {
        return EventRecord.builder()
                .id(event.getId())
                .assetId(event.getAssetId())
                .severity(Severity.parse(event.getSeverity()))
                .occurredAt(event.getOccurredAt())
                .build();
    }
}
