package com.canaris.analytics.api.controller;

import com.canaris.analytics.api.dto.BusinessImpactRequestDto;
import com.canaris.analytics.api.dto.RootCauseRequestDto;
import com.canaris.analytics.api.services.RootCauseService;
import com.canaris.analytics.rootcause.BusinessImpact;
import com.canaris.analytics.rootcause.RootCauseAnalysis;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/root-cause")
@RequiredArgsConstructor
public class RootCauseController {
    private final RootCauseService rootCauseService;

    @PostMapping("/analyze")
    public RootCauseAnalysis analyze(@Valid @RequestBody RootCauseRequestDto req) {
        return rootCauseService.analyze(req);
    }

    @PostMapping("/business-impact")
    public BusinessImpact businessImpact(@Valid @RequestBody BusinessImpactRequestDto req) {
        return rootCauseService.businessImpact(req);
    }
}
