package com.canaris.analytics.api.dto;

import com.canaris.analytics.model.TrainingSummary;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class TrainResponseDto {
    private TrainingSummary summary;
    private int seriesUsed;
    private List<String> failedAssets;
}
