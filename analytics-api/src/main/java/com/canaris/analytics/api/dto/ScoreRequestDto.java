package com.canaris.analytics.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Recent history of one metric; the last value is the point being scored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRequestDto {
    private String modelName;
    @NotEmpty
    private List<Double> values;
}
