package com.canaris.analytics.api.dto;

import com.canaris.analytics.model.AnomalyVerdict;
import com.canaris.analytics.statistics.StatisticalMethod;
import com.canaris.analytics.statistics.StatisticalSummary;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class StatisticalResponseDto {
    private StatisticalMethod method;
    private double threshold;
    private int anomalyCount;
    private List<Integer> anomalyIndices;
    private List<AnomalyVerdict> verdicts;
    private StatisticalSummary summary;
}
