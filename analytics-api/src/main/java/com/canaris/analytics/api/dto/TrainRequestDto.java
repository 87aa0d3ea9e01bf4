package com.canaris.analytics.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Either {@code values} to train on directly, or {@code assetIds} whose stored
 * history is collected for training.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainRequestDto {
    private String modelName;
    private List<Double> values;
    private List<String> assetIds;
    private String metricName;
    @Min(1)
    private Long lookbackSeconds;
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("0.5")
    private Double contamination;
}
