package com.canaris.analytics.api.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessImpactRequestDto {
    private String severity;
    /** 1 critical, 2 important, 3 standard (default). */
    private Integer assetTier;
    @Min(0)
    private int relatedEventsCount;
}
