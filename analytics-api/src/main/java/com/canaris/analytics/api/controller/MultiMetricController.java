package com.canaris.analytics.api.controller;

import com.canaris.analytics.api.dto.CorrelationsRequestDto;
import com.canaris.analytics.api.dto.MultiMetricDetectRequestDto;
import com.canaris.analytics.api.dto.MultiMetricTrainRequestDto;
import com.canaris.analytics.api.services.MultiMetricService;
import com.canaris.analytics.api.services.TrainingService;
import com.canaris.analytics.model.CompositeHealth;
import com.canaris.analytics.model.CorrelationAnalysis;
import com.canaris.analytics.model.MultivariateDetection;
import com.canaris.analytics.model.TrainingSummary;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/multi-metric")
@RequiredArgsConstructor
public class MultiMetricController {
    private final MultiMetricService multiMetricService;
    private final TrainingService trainingService;

    @PostMapping("/{model}/train")
    public TrainingSummary train(
            @Parameter(description = "Logical model name", required = true, example = "web-tier")
            @PathVariable(name = "model") String model,
            @Valid @RequestBody MultiMetricTrainRequestDto req) {
        return trainingService.trainMultivariate(model, req);
    }

    @PostMapping("/{model}/detect")
    public MultivariateDetection detect(
            @Parameter(description = "Logical model name", required = true, example = "web-tier")
            @PathVariable(name = "model") String model,
            @Valid @RequestBody MultiMetricDetectRequestDto req) {
        return multiMetricService.detect(model, req.getValues());
    }

    @PostMapping("/{model}/composite-health")
    public CompositeHealth compositeHealth(
            @Parameter(description = "Logical model name", required = true, example = "web-tier")
            @PathVariable(name = "model") String model,
            @Valid @RequestBody MultiMetricDetectRequestDto req) {
        return multiMetricService.compositeHealth(model, req.getValues());
    }

    @PostMapping("/correlations")
    public CorrelationAnalysis correlations(@Valid @RequestBody CorrelationsRequestDto req) {
        return multiMetricService.correlations(req.getMetrics());
    }
}
