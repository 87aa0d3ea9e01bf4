package com.canaris.analytics.api.controller;

import com.canaris.analytics.analysis.BatchAnalysisResult;
import com.canaris.analytics.api.dto.AssetAnalysisRequestDto;
import com.canaris.analytics.api.dto.DetectRequestDto;
import com.canaris.analytics.api.dto.DetectionResponseDto;
import com.canaris.analytics.api.dto.ScoreRequestDto;
import com.canaris.analytics.api.dto.StatisticalRequestDto;
import com.canaris.analytics.api.dto.StatisticalResponseDto;
import com.canaris.analytics.api.dto.TrainRequestDto;
import com.canaris.analytics.api.dto.TrainResponseDto;
import com.canaris.analytics.api.services.AnomalyDetectionService;
import com.canaris.analytics.api.services.TrainingService;
import com.canaris.analytics.model.AnomalyVerdict;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/anomaly")
@RequiredArgsConstructor
public class AnomalyController {
    private final AnomalyDetectionService detectionService;
    private final TrainingService trainingService;

    @PostMapping("/detect")
    public DetectionResponseDto detect(@Valid @RequestBody DetectRequestDto req) {
        return detectionService.detect(req);
    }

    @PostMapping("/train")
    public TrainResponseDto train(@Valid @RequestBody TrainRequestDto req) {
        return trainingService.trainUnivariate(req);
    }

    @PostMapping("/score")
    public AnomalyVerdict score(@Valid @RequestBody ScoreRequestDto req) {
        return detectionService.score(req);
    }

    @PostMapping("/statistical")
    public StatisticalResponseDto statistical(@Valid @RequestBody StatisticalRequestDto req) {
        return detectionService.statistical(req);
    }

    @PostMapping("/analyze-assets")
    public BatchAnalysisResult analyzeAssets(@Valid @RequestBody AssetAnalysisRequestDto req) {
        return detectionService.analyzeAssets(req);
    }
}
