package com.canaris.analytics.api.dto;

import com.canaris.analytics.model.AnomalyVerdict;
import com.canaris.analytics.model.DetectionMethod;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DetectionResponseDto {
    private String modelName;
    private String modelVersion;
    private DetectionMethod method;
    private int total;
    private int anomalyCount;
    private List<AnomalyVerdict> verdicts;
}
