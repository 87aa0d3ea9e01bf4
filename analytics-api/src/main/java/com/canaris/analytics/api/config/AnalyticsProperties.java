package com.canaris.analytics.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    /** Normalised ML score above which a point is anomalous. */
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double threshold = 0.7;

    /** Expected share of anomalies in training data; calibrates the decision boundary. */
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("0.5")
    private double contamination = 0.1;

    /** Shortest series that is featurised or scored. */
    @Min(1)
    private int minSamples = 10;

    /** Fewest feature vectors accepted when training from stored history. */
    @Min(1)
    private int minTrainingSamples = 100;

    /** Model used when a request names none. */
    @NotEmpty
    private String defaultModelName = "default";

    @Valid
    private Features features = new Features();

    @Valid
    private Forest forest = new Forest();

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Training training = new Training();

    @Valid
    private Correlation correlation = new Correlation();

    @Valid
    private Fetch fetch = new Fetch();

    @Data
    public static class Features {
        @NotEmpty
        private List<@Min(1) Integer> rollingWindows = new ArrayList<>(List.of(6));
        private List<@Min(1) Integer> lags = new ArrayList<>(List.of(1));
    }

    @Data
    public static class Forest {
        @Min(1)
        private int trees = 100;
        @Min(2)
        private int subsample = 256;
        private long seed = 42L;
    }

    @Data
    public static class Batch {
        /** Assets analysed, or histories fetched, at the same time. */
        @Min(1)
        private int concurrency = 4;
    }

    @Data
    public static class Training {
        @NotNull
        private Duration timeout = Duration.ofMinutes(5);
        @Min(1)
        private int threads = 1;
    }

    @Data
    public static class Correlation {
        @NotNull
        private Duration window = Duration.ofMinutes(30);
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int limit = 10_000;
        /** Look-back used when a request gives no time range. */
        @NotNull
        private Duration defaultTimeRange = Duration.ofSeconds(3600);
    }
}
