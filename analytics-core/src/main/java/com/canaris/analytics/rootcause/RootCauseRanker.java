package com.canaris.analytics.rootcause;

import com.canaris.analytics.correlation.Severity;
import com.canaris.analytics.statistics.Stats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks candidate assets for an event from direct involvement, related
 * events and recent metric spikes, and estimates business impact.
 */
@Slf4j
public class RootCauseRanker {

    static final double OWN_ASSET_WEIGHT = 0.5;
    static final double RELATED_EVENT_WEIGHT = 0.2;
    static final double SPIKE_WEIGHT = 0.3;
    static final int RECENT_VALUES = 5;
    static final double SPIKE_Z = 2.0;

    private final Clock clock;

    public RootCauseRanker(Clock clock) {
        this.clock = clock;
    }

    public RootCauseRanker() {
        this(Clock.systemUTC());
    }

    /**
     * @param assetMetrics recent values per asset id, oldest first
     */
    public RootCauseAnalysis analyze(EventRecord event, List<EventRecord> relatedEvents,
                                     Map<String, double[]> assetMetrics) {
        log.info("Analyzing event: {}", event.getId() == null ? "unknown" : event.getId());
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, List<String>> factors = new LinkedHashMap<>();

        if (hasText(event.getAssetId())) {
            add(scores, factors, event.getAssetId(), OWN_ASSET_WEIGHT, "asset of the analyzed event");
        }
        for (EventRecord related : relatedEvents) {
            if (hasText(related.getAssetId())) {
                add(scores, factors, related.getAssetId(), RELATED_EVENT_WEIGHT,
                        "related event " + (related.getId() == null ? "" : related.getId()).trim());
            }
        }
        assetMetrics.forEach((assetId, values) -> {
            if (values != null && hasSpike(values)) {
                add(scores, factors, assetId, SPIKE_WEIGHT, "metric spike in the last " + RECENT_VALUES + " values");
            }
        });

        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (max > 0) {
            scores.replaceAll((asset, score) -> Math.min(score / max, 1.0));
        }

        String root = null;
        double confidence = 0.0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            if (root == null || entry.getValue() > confidence) {
                root = entry.getKey();
                confidence = entry.getValue();
            }
        }
        if (root != null) {
            log.info("Root cause asset for event {}: {} (confidence {})", event.getId(), root, confidence);
        }

        return RootCauseAnalysis.builder()
                .eventId(event.getId())
                .rootCauseAssetId(root)
                .confidence(confidence)
                .assetScores(scores)
                .contributingFactors(root == null ? List.of() : factors.get(root))
                .correlatedEventsCount(relatedEvents.size())
                .analyzedAt(clock.instant())
                .build();
    }

    /**
     * Whether the newest of the last five values lies more than two standard
     * deviations from the mean of the values before it. A flat baseline counts
     * any departure from it as a spike.
     */
    static boolean hasSpike(double[] values) {
        double[] recent = Arrays.copyOfRange(values, Math.max(0, values.length - RECENT_VALUES), values.length);
        if (recent.length < 3) {
            return false;
        }
        double[] baseline = Arrays.copyOf(recent, recent.length - 1);
        double mean = Stats.mean(baseline);
        double std = Stats.std(baseline);
        double last = recent[recent.length - 1];
        if (std == 0) {
            return last != mean;
        }
        return Math.abs(last - mean) / std > SPIKE_Z;
    }

    /**
     * @param assetTier 1 critical, 2 important, 3 standard; other tiers count as standard
     * @param relatedEventsCount negative counts are treated as 0
     */
    public BusinessImpact calculateBusinessImpact(Severity severity, int assetTier, int relatedEventsCount) {
        double base;
        switch (severity == null ? Severity.INFO : severity) {
            case CRITICAL:
                base = 50;
                break;
            case WARNING:
                base = 30;
                break;
            default:
                base = 10;
        }
        double tierMultiplier;
        switch (assetTier) {
            case 1:
                tierMultiplier = 2.0;
                break;
            case 2:
                tierMultiplier = 1.5;
                break;
            default:
                tierMultiplier = 1.0;
        }
        double correlationMultiplier = 1.0 + Math.max(0, relatedEventsCount) * 0.1;
        double impact = Math.max(0.0, Math.min(base * tierMultiplier * correlationMultiplier, 100.0));
        long affectedUsers = (long) Math.floor(impact * 10);
        return BusinessImpact.builder()
                .businessImpactScore((int) Math.floor(impact))
                .affectedUsers(affectedUsers)
                .revenueAtRisk(affectedUsers * 100.0)
                .impactLevel(ImpactLevel.of(impact))
                .build();
    }

    private static void add(Map<String, Double> scores, Map<String, List<String>> factors,
                            String assetId, double weight, String factor) {
        scores.merge(assetId, weight, Double::sum);
        factors.computeIfAbsent(assetId, k -> new ArrayList<>()).add(factor);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
