package com.ethixai.drift.service;

import com.ethixai.drift.dto.DriftAnalysis;
import com.ethixai.drift.dto.DriftCycleResult;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.model.WindowMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest drift values per model as Micrometer gauges, scraped through the actuator prometheus endpoint.
 * Gauges are registered on first use and updated in place afterwards.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriftMetricsExporter {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, TrackedGauge> gauges = new ConcurrentHashMap<>();
    // gauges written from the latest snapshot of each model
    private final ConcurrentHashMap<String, Set<String>> snapshotGauges = new ConcurrentHashMap<>();
    private final Set<String> models = ConcurrentHashMap.newKeySet();

    /**
     * Replaces the model's snapshot gauges. Gauges the new snapshot no longer carries, such as features dropped
     * by a baseline replacement, are removed from the registry.
     */
    public synchronized void publishSnapshot(String modelId, DriftAnalysis analysis, boolean needsRetraining) {
        Tags model = Tags.of("model_id", modelId);
        Set<String> written = new HashSet<>();
        if (analysis.getFeatureDrifts() != null) {
            analysis.getFeatureDrifts().forEach((feature, drift) ->
                    written.add(set("drift_feature_psi", model.and("feature", feature), drift.getPsi())));
        }
        if (analysis.getScoreDrift() != null) {
            written.add(set("drift_score_kl", model, analysis.getScoreDrift().getKlDivergence()));
            written.add(set("drift_score_wasserstein", model, analysis.getScoreDrift().getWasserstein()));
        }
        if (analysis.getFairnessDrifts() != null) {
            analysis.getFairnessDrifts().values().forEach(drift -> written.add(set("drift_fairness_delta",
                    model.and("attribute", drift.getAttribute()).and("group", drift.getGroup()), drift.getDelta())));
        }
        if (analysis.getDataQualityDrifts() != null) {
            analysis.getDataQualityDrifts().forEach((feature, drift) -> written.add(
                    set("drift_data_quality_null_rate_delta", model.and("feature", feature), drift.getNullRateDelta())));
        }
        if (analysis.getExplanationDrift() != null) {
            written.add(set("drift_explanation_similarity", model,
                    analysis.getExplanationDrift().getCosineSimilarity()));
        }
        written.add(set("drift_window_samples", model, analysis.getSampleCount()));
        written.add(set("drift_overall_status", model,
                analysis.getOverallStatus() == null ? 0 : analysis.getOverallStatus().getCode()));
        written.add(set("drift_needs_retraining", model, needsRetraining ? 1 : 0));

        Set<String> previous = snapshotGauges.put(modelId, written);
        if (previous != null) {
            previous.stream().filter(key -> !written.contains(key)).forEach(this::remove);
        }
        models.add(modelId);
    }

    public void publishOpenAlerts(String modelId, Map<Severity, Long> openAlerts) {
        models.add(modelId);
        Tags model = Tags.of("model_id", modelId);
        for (Severity severity : new Severity[]{Severity.WARNING, Severity.CRITICAL}) {
            set("drift_open_alerts", model.and("severity", severity.name().toLowerCase()),
                    openAlerts.getOrDefault(severity, 0L));
        }
    }

    public void recordCycle(WindowMode mode, DriftCycleResult.Outcome outcome, Duration duration) {
        Counter.builder("drift_cycles_total")
                .tag("mode", mode.name().toLowerCase())
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry)
                .increment();
        Timer.builder("drift_cycle_duration")
                .tag("mode", mode.name().toLowerCase())
                .register(meterRegistry)
                .record(duration);
    }

    public void recordNotificationFailure(String channel) {
        Counter.builder("drift_notification_failures_total")
                .tag("channel", channel)
                .register(meterRegistry)
                .increment();
    }

    public Set<String> trackedModels() {
        return Set.copyOf(models);
    }

    private String set(String name, Tags tags, double value) {
        String key = name + tags;
        gauges.computeIfAbsent(key, ignored -> {
            AtomicReference<Double> holder = new AtomicReference<>(0.0);
            Gauge gauge = Gauge.builder(name, holder, AtomicReference::get).tags(tags).register(meterRegistry);
            return new TrackedGauge(holder, gauge);
        }).value().set(value);
        return key;
    }

    private void remove(String key) {
        TrackedGauge tracked = gauges.remove(key);
        if (tracked != null) {
            meterRegistry.remove(tracked.gauge());
            log.debug("Removed stale drift gauge {}", key);
        }
    }

    private record TrackedGauge(AtomicReference<Double> value, Gauge gauge) {
    }
}
