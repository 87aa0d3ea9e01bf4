package com.canaris.analytics.api.dto;

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
public class StatisticalRequestDto {
    @NotEmpty
    private List<Double> values;
    /** zscore (default), iqr or mad. */
    private String method;
    /** Method default when absent. */
    private Double threshold;
    private boolean withSeverity;
}
