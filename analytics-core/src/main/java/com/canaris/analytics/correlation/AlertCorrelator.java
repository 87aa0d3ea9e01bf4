package com.canaris.analytics.correlation;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Groups related alerts to cut noise and picks the alert most likely to be
 * the root cause.
 * <p>
 * Alerts are grouped three ways: by shared fingerprint, by affected asset,
 * and into time clusters where each alert follows the previous one within the
 * correlation window. Only groups with more than one member are reported.
 */
@Slf4j
public class AlertCorrelator {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(30);

    static final int STORM_SIZE = 5;
    private static final int SUPPRESSION_MIN_MEMBERS = 2;
    private static final double SUPPRESSION_MIN_SCORE = 0.7;

    private final Clock clock;

    public AlertCorrelator(Clock clock) {
        this.clock = clock;
    }

    public AlertCorrelator() {
        this(Clock.systemUTC());
    }

    public CorrelationResult findCorrelatedAlerts(List<Alert> alerts) {
        return findCorrelatedAlerts(alerts, DEFAULT_WINDOW);
    }

    public CorrelationResult findCorrelatedAlerts(List<Alert> alerts, Duration window) {
        log.info("Starting correlation analysis for {} alerts", alerts.size());
        if (alerts.isEmpty()) {
            return CorrelationResult.builder().totalAlerts(0).build();
        }
        if (window.isNegative()) {
            throw new IllegalArgumentException("Correlation window must not be negative: " + window);
        }

        Map<String, List<Alert>> byFingerprint = new LinkedHashMap<>();
        Map<String, List<Alert>> byAsset = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            if (alert.getFingerprint() != null && !alert.getFingerprint().isBlank()) {
                byFingerprint.computeIfAbsent(alert.getFingerprint(), k -> new ArrayList<>()).add(alert);
            }
            String asset = alert.groupingAssetId();
            if (asset != null && !asset.isBlank()) {
                byAsset.computeIfAbsent(asset, k -> new ArrayList<>()).add(alert);
            }
        }
        log.info("Found {} fingerprint groups and {} asset groups", byFingerprint.size(), byAsset.size());

        List<List<Integer>> clusters = timeClusters(alerts, window);
        log.info("Found {} time clusters", clusters.size());

        List<CorrelationGroup> groups = new ArrayList<>();
        byFingerprint.forEach((fingerprint, members) -> {
            if (members.size() > 1) {
                groups.add(group(CorrelationType.FINGERPRINT, fingerprint, ids(members), window));
            }
        });
        byAsset.forEach((asset, members) -> {
            if (members.size() > 1) {
                groups.add(group(CorrelationType.ASSET, asset, ids(members), window));
            }
        });
        for (List<Integer> cluster : clusters) {
            List<String> ids = cluster.stream().map(i -> alerts.get(i).getId()).collect(Collectors.toList());
            groups.add(group(CorrelationType.TIME_CLUSTER, "cluster_" + groups.size(), ids, window));
        }

        boolean storm = groups.stream()
                .anyMatch(g -> g.getType() == CorrelationType.TIME_CLUSTER && g.getAlertCount() > STORM_SIZE);
        if (storm) {
            log.warn("Alert storm detected among {} alerts", alerts.size());
        }
        log.info("Built {} correlation groups", groups.size());

        return CorrelationResult.builder()
                .totalAlerts(alerts.size())
                .groups(groups)
                .alertStormDetected(storm)
                .uniqueFingerprints(byFingerprint.size())
                .uniqueAssets(byAsset.size())
                .timeClusters(clusters.size())
                .build();
    }

    /**
     * Suggests keeping the first member of every strongly correlated group
     * with more than two members and suppressing the others.
     */
    public SuppressionResult suggestSuppression(List<Alert> alerts, CorrelationResult correlation) {
        List<SuppressionSuggestion> suggestions = new ArrayList<>();
        for (CorrelationGroup group : correlation.getGroups()) {
            if (group.getAlertCount() > SUPPRESSION_MIN_MEMBERS && group.getCorrelationScore() > SUPPRESSION_MIN_SCORE) {
                List<String> ids = group.getAlertIds();
                suggestions.add(SuppressionSuggestion.builder()
                        .groupType(group.getType())
                        .keepAlertId(ids.get(0))
                        .suppressAlertIds(List.copyOf(ids.subList(1, ids.size())))
                        .reason("High correlation (" + group.getCorrelationScore() + ") - " + group.getReason())
                        .build());
            }
        }
        int suppressible = suggestions.stream().mapToInt(SuppressionSuggestion::getAlertsToSuppress).sum();
        double percent = alerts.isEmpty() ? 0.0 : BigDecimal.valueOf(suppressible * 100.0 / alerts.size())
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        return SuppressionResult.builder()
                .suggestions(suggestions)
                .totalAlerts(alerts.size())
                .suppressibleAlerts(suppressible)
                .noiseReductionPercent(percent)
                .build();
    }

    /**
     * Scores each alert as {@code 100 / (1 + age in hours) + impact / 2 + severity bonus}
     * (critical 50, warning 25) and returns the best. Ties keep the earlier alert in the list.
     */
    public Optional<RootCauseAlert> identifyRootCauseAlert(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Alert best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Alert alert : alerts) {
            double score = rootCauseScore(alert, now);
            if (score > bestScore) {
                best = alert;
                bestScore = score;
            }
        }
        log.info("Root cause alert {} with score {}", best.getId(), bestScore);
        return Optional.of(RootCauseAlert.builder()
                .alertId(best.getId())
                .score(bestScore)
                .confidence(Math.min(bestScore / 200.0, 1.0))
                .reason("Earliest occurrence with highest business impact")
                .build());
    }

    double rootCauseScore(Alert alert, Instant now) {
        double score = 0.0;
        if (alert.getCreatedAt() != null) {
            double hours = Math.max(0.0, Duration.between(alert.getCreatedAt(), now).toMillis() / 3_600_000.0);
            score += 100.0 / (1.0 + hours);
        }
        score += alert.impactOrZero() * 0.5;
        if (alert.getSeverity() == Severity.CRITICAL) {
            score += 50;
        } else if (alert.getSeverity() == Severity.WARNING) {
            score += 25;
        }
        return score;
    }

    /**
     * Indices of alerts forming chains where consecutive alerts (by creation
     * time) are at most {@code window} apart. Clusters of one are dropped;
     * members are listed in input order.
     */
    private List<List<Integer>> timeClusters(List<Alert> alerts, Duration window) {
        Instant now = clock.instant();
        List<Integer> byTime = IntStream.range(0, alerts.size()).boxed()
                .sorted(Comparator.comparing(i -> createdAt(alerts.get(i), now)))
                .collect(Collectors.toList());

        List<List<Integer>> clusters = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        Instant previous = null;
        for (int index : byTime) {
            Instant created = createdAt(alerts.get(index), now);
            if (previous != null && Duration.between(previous, created).compareTo(window) > 0) {
                addCluster(clusters, current);
                current = new ArrayList<>();
            }
            current.add(index);
            previous = created;
        }
        addCluster(clusters, current);
        return clusters;
    }

    private static void addCluster(List<List<Integer>> clusters, List<Integer> members) {
        if (members.size() > 1) {
            members.sort(Comparator.naturalOrder());
            clusters.add(members);
        }
    }

    private static Instant createdAt(Alert alert, Instant now) {
        return alert.getCreatedAt() != null ? alert.getCreatedAt() : now;
    }

    private static List<String> ids(List<Alert> alerts) {
        return alerts.stream().map(Alert::getId).collect(Collectors.toList());
    }

    private static CorrelationGroup group(CorrelationType type, String key, List<String> ids, Duration window) {
        return CorrelationGroup.builder()
                .type(type)
                .key(key)
                .alertIds(List.copyOf(ids))
                .correlationScore(type.score())
                .reason(type.reason(window.toMinutes()))
                .build();
    }
}
