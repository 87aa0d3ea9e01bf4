package com.canaris.analytics.api.services;

import com.canaris.analytics.api.config.AnalyticsProperties;
import com.canaris.analytics.api.dto.AlertCorrelationRequestDto;
import com.canaris.analytics.api.dto.AlertDto;
import com.canaris.analytics.correlation.Alert;
import com.canaris.analytics.correlation.AlertCorrelator;
import com.canaris.analytics.correlation.CorrelationResult;
import com.canaris.analytics.correlation.RootCauseAlert;
import com.canaris.analytics.correlation.Severity;
import com.canaris.analytics.correlation.SuppressionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class AlertCorrelationService {

    private final AlertCorrelator correlator;
    private final AnalyticsProperties properties;

    public CorrelationResult findCorrelations(AlertCorrelationRequestDto request) {
        return correlator.findCorrelatedAlerts(toAlerts(request.getAlerts()), window(request));
    }

    public SuppressionResult suggestSuppression(AlertCorrelationRequestDto request) {
        List<Alert> alerts = toAlerts(request.getAlerts());
        CorrelationResult correlation = correlator.findCorrelatedAlerts(alerts, window(request));
        return correlator.suggestSuppression(alerts, correlation);
    }

    public Optional<RootCauseAlert> identifyRootCause(AlertCorrelationRequestDto request) {
        return correlator.identifyRootCauseAlert(toAlerts(request.getAlerts()));
    }

    private Duration window(AlertCorrelationRequestDto request) {
        return request.getTimeWindowMinutes() != null
                ? Duration.ofMinutes(request.getTimeWindowMinutes())
                : properties.getCorrelation().getWindow();
    }

    static List<Alert> toAlerts(List<AlertDto> alerts) {
        return Conversions.orEmpty(alerts).stream()
                .map(a -> Alert.builder()
                        .id(a.getId())
                        .assetId(a.getAssetId())
                        .rootCauseAssetId(a.getRootCauseAssetId())
                        .fingerprint(a.getFingerprint())
                        .severity(Severity.parse(a.getSeverity()))
                        .createdAt(a.getCreatedAt())
                        .businessImpactScore(a.getBusinessImpactScore())
                        .build())
                .toList();
    }
}
