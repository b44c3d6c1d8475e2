package com.ethixai.drift.service;

import com.ethixai.drift.dto.AlertListResponse;
import com.ethixai.drift.dto.AlertResponse;
import com.ethixai.drift.dto.DataQualityDrift;
import com.ethixai.drift.dto.DriftSnapshotResponse;
import com.ethixai.drift.dto.DriftStatusResponse;
import com.ethixai.drift.dto.ExplanationDrift;
import com.ethixai.drift.dto.FairnessDrift;
import com.ethixai.drift.dto.FeatureDrift;
import com.ethixai.drift.dto.ResolveAlertResponse;
import com.ethixai.drift.dto.ScoreDrift;
import com.ethixai.drift.dto.SnapshotListResponse;
import com.ethixai.drift.exception.AlreadyResolvedException;
import com.ethixai.drift.exception.BadRequestException;
import com.ethixai.drift.exception.NotFoundException;
import com.ethixai.drift.model.DriftAlert;
import com.ethixai.drift.model.DriftSnapshot;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.repository.DriftAlertRepository;
import com.ethixai.drift.repository.DriftSnapshotRepository;
import com.ethixai.drift.util.JsonCodec;
import com.ethixai.drift.util.ModelIds;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the admin API. Missing data yields empty results, never errors.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DriftQueryService {

    static final int MAX_LIMIT = 1000;
    static final int MAX_DAYS = 365;
    static final int STATUS_ACTIVE_ALERTS = 10;

    private static final TypeReference<Map<String, FeatureDrift>> FEATURE_DRIFTS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, FairnessDrift>> FAIRNESS_DRIFTS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, DataQualityDrift>> QUALITY_DRIFTS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> DETAILS = new TypeReference<>() {
    };

    private final DriftSnapshotRepository snapshotRepository;
    private final DriftAlertRepository alertRepository;
    private final AlertService alertService;
    private final BaselineService baselineService;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SnapshotListResponse listSnapshots(String modelId, int days, int limit) {
        ModelIds.validate(modelId);
        requireRange("days", days, MAX_DAYS);
        requireRange("limit", limit, MAX_LIMIT);
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<DriftSnapshotResponse> snapshots = snapshotRepository
                .findByModelIdAndWindowEndGreaterThanEqualOrderByWindowEndDesc(modelId, since, PageRequest.of(0, limit))
                .stream()
                .map(this::toResponse)
                .toList();
        return SnapshotListResponse.builder()
                .modelId(modelId)
                .count(snapshots.size())
                .snapshots(snapshots)
                .build();
    }

    @Transactional(readOnly = true)
    public AlertListResponse listAlerts(String modelId, Severity severity, boolean resolved, int limit) {
        ModelIds.validate(modelId);
        requireRange("limit", limit, MAX_LIMIT);
        List<AlertResponse> alerts = alertRepository.search(modelId, severity, resolved, PageRequest.of(0, limit))
                .stream()
                .map(this::toResponse)
                .toList();
        return AlertListResponse.builder()
                .modelId(modelId)
                .count(alerts.size())
                .alerts(alerts)
                .build();
    }

    @Transactional(readOnly = true)
    public DriftStatusResponse status(String modelId) {
        ModelIds.validate(modelId);
        Optional<DriftSnapshot> latest = snapshotRepository.findTopByModelIdOrderByWindowEndDescIdDesc(modelId);
        Map<Severity, Long> open = alertService.openAlertCounts(modelId);
        List<AlertResponse> active = alertRepository
                .findByModelIdAndResolvedFalseOrderByCreatedAtDesc(modelId, PageRequest.of(0, STATUS_ACTIVE_ALERTS))
                .stream()
                .map(this::toResponse)
                .toList();
        Long baselineAgeDays = baselineService.createdAt(modelId)
                .map(createdAt -> Duration.between(createdAt, clock.instant()).toDays())
                .orElse(null);
        return DriftStatusResponse.builder()
                .modelId(modelId)
                .currentStatus(latest.map(snapshot -> snapshot.getOverallStatus().name()).orElse("UNKNOWN"))
                .criticalAlerts(open.getOrDefault(Severity.CRITICAL, 0L))
                .warningAlerts(open.getOrDefault(Severity.WARNING, 0L))
                .needsRetraining(latest.map(DriftSnapshot::isNeedsRetraining).orElse(false))
                .latestSnapshot(latest.map(this::toResponse).orElse(null))
                .activeAlerts(active)
                .baselineAgeDays(baselineAgeDays)
                .build();
    }

    /**
     * Resolves an alert, treating an already resolved alert as success without touching it.
     */
    public ResolveAlertResponse resolve(Long alertId, String resolutionNote, String actor) {
        try {
            DriftAlert alert = alertService.resolve(alertId, resolutionNote, actor);
            return ResolveAlertResponse.builder()
                    .success(true)
                    .alreadyResolved(false)
                    .message("Alert resolved")
                    .alert(toResponse(alert))
                    .build();
        } catch (AlreadyResolvedException e) {
            log.debug("Alert {} already resolved", alertId);
            DriftAlert alert = alertRepository.findById(alertId)
                    .orElseThrow(() -> new NotFoundException("Alert " + alertId + " not found"));
            return ResolveAlertResponse.builder()
                    .success(true)
                    .alreadyResolved(true)
                    .message(e.getMessage())
                    .alert(toResponse(alert))
                    .build();
        }
    }

    public DriftSnapshotResponse toResponse(DriftSnapshot snapshot) {
        return DriftSnapshotResponse.builder()
                .id(snapshot.getId())
                .modelId(snapshot.getModelId())
                .mode(snapshot.getMode())
                .windowStart(snapshot.getWindowStart())
                .windowEnd(snapshot.getWindowEnd())
                .sampleCount(snapshot.getSampleCount())
                .featureDrifts(jsonCodec.read(snapshot.getFeatureDrifts(), FEATURE_DRIFTS))
                .scoreDrift(jsonCodec.read(snapshot.getScoreDrift(), ScoreDrift.class))
                .fairnessDrift(jsonCodec.read(snapshot.getFairnessDrift(), FAIRNESS_DRIFTS))
                .dataQualityDrift(jsonCodec.read(snapshot.getDataQualityDrift(), QUALITY_DRIFTS))
                .explanationDrift(jsonCodec.read(snapshot.getExplanationDrift(), ExplanationDrift.class))
                .overallStatus(snapshot.getOverallStatus())
                .criticalCount(snapshot.getCriticalCount())
                .warningCount(snapshot.getWarningCount())
                .needsRetraining(snapshot.isNeedsRetraining())
                .createdAt(snapshot.getCreatedAt())
                .build();
    }

    public AlertResponse toResponse(DriftAlert alert) {
        return AlertResponse.builder()
                .id(alert.getId())
                .fingerprint(alert.getFingerprint())
                .modelId(alert.getModelId())
                .type(alert.getType())
                .severity(alert.getSeverity())
                .metricName(alert.getMetricName())
                .metricValue(alert.getMetricValue())
                .threshold(alert.getThreshold())
                .windowStart(alert.getWindowStart())
                .windowEnd(alert.getWindowEnd())
                .details(jsonCodec.read(alert.getDetails(), DETAILS))
                .resolved(alert.isResolved())
                .resolvedAt(alert.getResolvedAt())
                .resolutionNote(alert.getResolutionNote())
                .occurrenceCount(alert.getOccurrenceCount())
                .createdAt(alert.getCreatedAt())
                .updatedAt(alert.getUpdatedAt())
                .build();
    }

    private static void requireRange(String name, int value, int max) {
        if (value < 1 || value > max) {
            throw new BadRequestException(name + " must be between 1 and " + max);
        }
    }
}
