package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.CleanupResult;
import com.ethixai.drift.model.DriftDailySummary;
import com.ethixai.drift.model.DriftSnapshot;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.repository.DriftAlertRepository;
import com.ethixai.drift.repository.DriftDailySummaryRepository;
import com.ethixai.drift.repository.DriftSnapshotRepository;
import com.ethixai.drift.service.notification.DriftNotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Daily maintenance: roll yesterday's snapshots into per-model summaries, then enforce retention on
 * snapshots, alerts and summaries. Steps run in separate transactions and a failing step does not stop the rest.
 */
@Service
@Slf4j
public class RetentionService {

    private final DriftSnapshotRepository snapshotRepository;
    private final DriftAlertRepository alertRepository;
    private final DriftDailySummaryRepository summaryRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final DriftProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RetentionService(DriftSnapshotRepository snapshotRepository,
                            DriftAlertRepository alertRepository,
                            DriftDailySummaryRepository summaryRepository,
                            ApplicationEventPublisher eventPublisher,
                            DriftProperties properties,
                            PlatformTransactionManager transactionManager,
                            Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.alertRepository = alertRepository;
        this.summaryRepository = summaryRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public CleanupResult runCleanup() {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        DriftProperties.Retention retention = properties.getRetention();
        log.info("Drift retention job started at {}", now);

        CleanupResult.StepResult aggregation = step("aggregate daily summaries",
                () -> aggregateDay(today.minusDays(1)));
        CleanupResult.StepResult snapshots = step("delete expired snapshots",
                () -> snapshotRepository.deleteByWindowEndBefore(now.minus(retention.getSnapshots())));
        CleanupResult.StepResult alerts = step("delete expired alerts",
                () -> alertRepository.deleteByCreatedAtBefore(now.minus(retention.getAlerts())));
        CleanupResult.StepResult summaries = step("archive daily summaries",
                () -> summaryRepository.deleteBySummaryDateBefore(today.minusDays(retention.getDailySummaries().toDays())));

        if (alerts.affected() > 0) {
            eventPublisher.publishEvent(AlertsChangedEvent.allModels());
        }
        CleanupResult result = new CleanupResult(aggregation, snapshots, alerts, summaries);
        log.info("Drift retention job finished summaries={} snapshotsDeleted={} alertsDeleted={} summariesArchived={}",
                aggregation.affected(), snapshots.affected(), alerts.affected(), summaries.affected());
        return result;
    }

    /**
     * Writes one summary per model with snapshots ending on {@code day} (UTC). Re-running for the same day
     * overwrites the earlier summaries.
     */
    public int aggregateDay(LocalDate day) {
        Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        List<DriftSnapshot> snapshots = snapshotRepository
                .findByWindowEndGreaterThanEqualAndWindowEndLessThanOrderByModelIdAscWindowEndAscIdAsc(from, to);
        if (snapshots.isEmpty()) {
            log.info("No snapshots to aggregate for {}", day);
            return 0;
        }
        Map<String, List<DriftSnapshot>> byModel = snapshots.stream()
                .collect(Collectors.groupingBy(DriftSnapshot::getModelId, LinkedHashMap::new, Collectors.toList()));
        byModel.forEach((modelId, modelSnapshots) -> {
            DriftDailySummary summary = summaryRepository.findByModelIdAndSummaryDate(modelId, day)
                    .orElseGet(() -> DriftDailySummary.builder().modelId(modelId).summaryDate(day).build());
            summarize(summary, modelSnapshots);
            summaryRepository.save(summary);
            eventPublisher.publishEvent(new DriftNotificationEvent(
                    DriftNotificationEvent.Kind.DAILY_SUMMARY,
                    modelId,
                    summary.getOverallStatus(),
                    "Daily drift summary for " + modelId + " on " + day,
                    summary.getSnapshotCount() + " snapshots, max critical signals " + summary.getMaxCriticalCount()
                            + ", needs retraining " + summary.isNeedsRetraining(),
                    Map.of("date", day.toString(), "snapshots", summary.getSnapshotCount()),
                    clock.instant()));
        });
        log.info("Aggregated {} snapshots into {} daily summaries for {}", snapshots.size(), byModel.size(), day);
        return byModel.size();
    }

    private void summarize(DriftDailySummary summary, List<DriftSnapshot> snapshots) {
        int maxCritical = 0;
        int maxWarning = 0;
        long sumCritical = 0;
        long sumWarning = 0;
        boolean needsRetraining = false;
        for (DriftSnapshot snapshot : snapshots) {
            maxCritical = Math.max(maxCritical, snapshot.getCriticalCount());
            maxWarning = Math.max(maxWarning, snapshot.getWarningCount());
            sumCritical += snapshot.getCriticalCount();
            sumWarning += snapshot.getWarningCount();
            needsRetraining |= snapshot.isNeedsRetraining();
        }
        Severity closing = snapshots.get(snapshots.size() - 1).getOverallStatus();
        summary.setSnapshotCount(snapshots.size());
        summary.setAvgCriticalCount((double) sumCritical / snapshots.size());
        summary.setMaxCriticalCount(maxCritical);
        summary.setAvgWarningCount((double) sumWarning / snapshots.size());
        summary.setMaxWarningCount(maxWarning);
        summary.setOverallStatus(closing);
        summary.setNeedsRetraining(needsRetraining);
        summary.setCreatedAt(clock.instant());
    }

    private CleanupResult.StepResult step(String name, Supplier<Integer> action) {
        try {
            Integer affected = transactionTemplate.execute(status -> action.get());
            log.info("Retention step '{}' affected {} rows", name, affected);
            return CleanupResult.StepResult.ok(affected == null ? 0 : affected);
        } catch (RuntimeException e) {
            log.error("Retention step '{}' failed", name, e);
            return CleanupResult.StepResult.failed(e.getMessage());
        }
    }
}
