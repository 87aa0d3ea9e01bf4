package com.canaris.analytics.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
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
public class RootCauseRequestDto {
    @Valid
    @NotNull
    private EventDto event;
    private List<EventDto> relatedEvents;
    /** Recent values per asset id, oldest first. */
    private Map<String, List<Double>> assetMetrics;
}
