package com.canaris.analytics.api.config;

import com.canaris.analytics.model.DetectorRegistry;
import com.canaris.analytics.model.UnivariateModel;
import com.canaris.analytics.store.ModelStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class DetectorWarmUpConfig {

    private final DetectorRegistry detectorRegistry;
    private final ModelStore modelStore;
    private final AnalyticsProperties properties;

    @Bean
    ApplicationRunner loadDefaultDetector() {
        return args -> {
            UnivariateModel model = detectorRegistry.univariate(properties.getDefaultModelName());
            log.info("Default detector '{}' ready, trained: {}, stored models: {}",
                    model.getName(), model.isTrained(), modelStore.listModels().size());
        };
    }

}
