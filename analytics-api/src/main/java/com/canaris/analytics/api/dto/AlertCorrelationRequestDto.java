package com.canaris.analytics.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertCorrelationRequestDto {
    @Valid
    @NotNull
    private List<AlertDto> alerts;
    @Min(0)
    private Integer timeWindowMinutes;
}
