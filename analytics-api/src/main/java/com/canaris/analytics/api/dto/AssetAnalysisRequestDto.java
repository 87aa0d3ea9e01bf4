package com.canaris.analytics.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetAnalysisRequestDto {
    @NotEmpty
    private List<String> assetIds;
    /** Every metric of the asset when empty. */
    private List<String> metricNames;
    @Min(1)
    private Long lookbackSeconds;
    /** Defaults to true. */
    private Boolean useMl;
    private String modelName;
    @JsonProperty("zThreshold")
    private Double zThreshold;
}
