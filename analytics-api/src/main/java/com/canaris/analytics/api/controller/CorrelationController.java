package com.canaris.analytics.api.controller;

import com.canaris.analytics.api.dto.AlertCorrelationRequestDto;
import com.canaris.analytics.api.services.AlertCorrelationService;
import com.canaris.analytics.correlation.CorrelationResult;
import com.canaris.analytics.correlation.RootCauseAlert;
import com.canaris.analytics.correlation.SuppressionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/correlation")
@RequiredArgsConstructor
public class CorrelationController {
    private final AlertCorrelationService correlationService;

    @PostMapping("/find-correlations")
    public CorrelationResult findCorrelations(@Valid @RequestBody AlertCorrelationRequestDto req) {
        return correlationService.findCorrelations(req);
    }

    @PostMapping("/suggest-suppression")
    public SuppressionResult suggestSuppression(@Valid @RequestBody AlertCorrelationRequestDto req) {
        return correlationService.suggestSuppression(req);
    }

    /** 204 when there are no alerts to rank. */
    @PostMapping("/identify-root-cause")
    public ResponseEntity<RootCauseAlert> identifyRootCause(@Valid @RequestBody AlertCorrelationRequestDto req) {
        return correlationService.identifyRootCause(req)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
