package com.ethixai.drift.service;

import com.ethixai.drift.dto.DriftAnalysis;
import com.ethixai.drift.dto.DriftCycleResult;
import com.ethixai.drift.dto.FairnessDrift;
import com.ethixai.drift.dto.FeatureDrift;
import com.ethixai.drift.dto.ScoreDrift;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.model.WindowMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DriftMetricsExporterTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DriftMetricsExporter exporter = new DriftMetricsExporter(registry);

    @Test
    void gaugesFollowLatestSnapshot() {
        exporter.publishSnapshot("fraud-v7", analysis(0.31, Severity.CRITICAL), true);
        exporter.publishSnapshot("fraud-v7", analysis(0.04, Severity.STABLE), false);

        assertThat(registry.get("drift_feature_psi").tag("model_id", "fraud-v7").tag("feature", "amount")
                .gauge().value()).isEqualTo(0.04);
        assertThat(registry.get("drift_overall_status").tag("model_id", "fraud-v7").gauge().value()).isZero();
        assertThat(registry.get("drift_needs_retraining").tag("model_id", "fraud-v7").gauge().value()).isZero();
        assertThat(registry.get("drift_score_kl").tag("model_id", "fraud-v7").gauge().value()).isEqualTo(0.2);
        assertThat(registry.get("drift_fairness_delta").tag("attribute", "gender").tag("group", "F")
                .gauge().value()).isEqualTo(0.03);
        assertThat(registry.find("drift_feature_psi").gauges()).hasSize(1);
    }

    @Test
    void featuresMissingFromLatestSnapshotLoseTheirGauges() {
        exporter.publishSnapshot("fraud-v7", analysis(0.31, Severity.CRITICAL), true);

        DriftAnalysis withoutFeatures = DriftAnalysis.builder()
                .sampleCount(200)
                .overallStatus(Severity.STABLE)
                .build();
        exporter.publishSnapshot("fraud-v7", withoutFeatures, false);

        assertThat(registry.find("drift_feature_psi").gauges()).isEmpty();
        assertThat(registry.find("drift_fairness_delta").gauges()).isEmpty();
        assertThat(registry.find("drift_score_kl").gauges()).isEmpty();
        assertThat(registry.get("drift_window_samples").tag("model_id", "fraud-v7").gauge().value()).isEqualTo(200.0);
        assertThat(exporter.trackedModels()).containsExactly("fraud-v7");
    }

    @Test
    void modelsAreTaggedSeparately() {
        exporter.publishSnapshot("fraud-v7", analysis(0.31, Severity.CRITICAL), true);
        exporter.publishSnapshot("churn-v2", analysis(0.02, Severity.STABLE), false);

        assertThat(registry.get("drift_overall_status").tag("model_id", "fraud-v7").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("drift_overall_status").tag("model_id", "churn-v2").gauge().value()).isZero();
    }

    @Test
    void openAlertsAreLabelledBySeverity() {
        Map<Severity, Long> open = new EnumMap<>(Severity.class);
        open.put(Severity.CRITICAL, 3L);

        exporter.publishOpenAlerts("fraud-v7", open);

        assertThat(registry.get("drift_open_alerts").tag("severity", "critical").gauge().value()).isEqualTo(3.0);
        assertThat(registry.get("drift_open_alerts").tag("severity", "warning").gauge().value()).isZero();
    }

    @Test
    void cyclesAreCountedByOutcome() {
        exporter.recordCycle(WindowMode.STREAMING, DriftCycleResult.Outcome.COMPLETED, Duration.ofMillis(40));
        exporter.recordCycle(WindowMode.STREAMING, DriftCycleResult.Outcome.COMPLETED, Duration.ofMillis(60));
        exporter.recordCycle(WindowMode.BATCH, DriftCycleResult.Outcome.SKIPPED, Duration.ZERO);

        assertThat(registry.get("drift_cycles_total").tag("mode", "streaming").tag("outcome", "completed")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("drift_cycles_total").tag("mode", "batch").tag("outcome", "skipped")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.get("drift_cycle_duration").tag("mode", "streaming").timer().count()).isEqualTo(2);
    }

    private static DriftAnalysis analysis(double psi, Severity status) {
        return DriftAnalysis.builder()
                .sampleCount(500)
                .featureDrifts(Map.of("amount", FeatureDrift.builder().feature("amount").psi(psi).severity(status).build()))
                .scoreDrift(ScoreDrift.builder().klDivergence(0.2).wasserstein(0.05).severity(Severity.WARNING).build())
                .fairnessDrifts(Map.of("gender:F", FairnessDrift.builder()
                        .attribute("gender").group("F").delta(0.03).severity(Severity.STABLE).build()))
                .overallStatus(status)
                .build();
    }
}
