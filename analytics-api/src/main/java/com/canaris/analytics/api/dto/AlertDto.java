package com.canaris.analytics.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDto {
    @NotBlank
    private String id;
    private String assetId;
    private String rootCauseAssetId;
    private String fingerprint;
    /** critical, warning or info. */
    private String severity;
    private Instant createdAt;
    private Double businessImpactScore;
}
