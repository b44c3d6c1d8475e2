package com.ethixai.drift.service;

import com.ethixai.drift.dto.DriftAnalysis;
import com.ethixai.drift.dto.DriftSnapshotResponse;
import com.ethixai.drift.repository.DriftSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Collection;
import java.util.List;

/**
 * Keeps the drift gauges current between cycles: seeds them from persisted snapshots at startup and
 * recounts open alerts whenever alerts are resolved or purged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriftMetricsRefresher {

    private final DriftMetricsExporter metricsExporter;
    private final AlertService alertService;
    private final DriftQueryService driftQueryService;
    private final DriftSnapshotRepository snapshotRepository;

    @EventListener(ApplicationReadyEvent.class)
    public void seedFromStore() {
        List<String> modelIds = snapshotRepository.findDistinctModelIds();
        for (String modelId : modelIds) {
            try {
                snapshotRepository.findTopByModelIdOrderByWindowEndDescIdDesc(modelId)
                        .map(driftQueryService::toResponse)
                        .ifPresent(latest -> metricsExporter.publishSnapshot(modelId, toAnalysis(latest),
                                latest.isNeedsRetraining()));
                metricsExporter.publishOpenAlerts(modelId, alertService.openAlertCounts(modelId));
            } catch (RuntimeException e) {
                log.warn("Failed to seed drift gauges model={} error={}", modelId, e.getMessage());
            }
        }
        log.info("Drift gauges seeded for {} models", modelIds.size());
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onAlertsChanged(AlertsChangedEvent event) {
        Collection<String> modelIds = event.modelId() != null
                ? List.of(event.modelId())
                : metricsExporter.trackedModels();
        for (String modelId : modelIds) {
            try {
                metricsExporter.publishOpenAlerts(modelId, alertService.openAlertCounts(modelId));
            } catch (RuntimeException e) {
                log.warn("Failed to refresh open alert gauges model={} error={}", modelId, e.getMessage());
            }
        }
    }

    private static DriftAnalysis toAnalysis(DriftSnapshotResponse snapshot) {
        return DriftAnalysis.builder()
                .sampleCount(snapshot.getSampleCount())
                .featureDrifts(snapshot.getFeatureDrifts())
                .scoreDrift(snapshot.getScoreDrift())
                .fairnessDrifts(snapshot.getFairnessDrift())
                .dataQualityDrifts(snapshot.getDataQualityDrift())
                .explanationDrift(snapshot.getExplanationDrift())
                .overallStatus(snapshot.getOverallStatus())
                .criticalCount(snapshot.getCriticalCount())
                .warningCount(snapshot.getWarningCount())
                .build();
    }
}
