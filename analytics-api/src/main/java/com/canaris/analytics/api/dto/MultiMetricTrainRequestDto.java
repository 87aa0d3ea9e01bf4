package com.canaris.analytics.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiMetricTrainRequestDto {
    /** Equal-length series keyed by metric name; column order follows the JSON object. */
    @NotEmpty
    private Map<String, List<Double>> metrics;
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("0.5")
    private Double contamination;
}
