package com.canaris.analytics.api.services;

import com.canaris.analytics.api.config.AnalyticsProperties;
import com.canaris.analytics.model.CompositeHealth;
import com.canaris.analytics.model.CorrelationAnalysis;
import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.MultivariateDetection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class MultiMetricService {

    private final DetectorRegistry registry;
    private final AnalyticsProperties properties;

    public MultivariateDetection detect(String modelName, Map<String, Double> values) {
        return registry.multivariate(modelName).detect(values);
    }

    public CompositeHealth compositeHealth(String modelName, Map<String, Double> values) {
        return registry.multivariate(modelName).compositeHealth(values);
    }

    /** Needs no trained state, so the default model's detector does the arithmetic. */
    public CorrelationAnalysis correlations(Map<String, List<Double>> metrics) {
        return registry.multivariate(properties.getDefaultModelName())
                .analyzeCorrelations(Conversions.toArrays(metrics));
    }
}
