package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.CleanupResult;
import com.ethixai.drift.model.AlertType;
import com.ethixai.drift.model.DriftAlert;
import com.ethixai.drift.model.DriftDailySummary;
import com.ethixai.drift.model.DriftSnapshot;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.model.WindowMode;
import com.ethixai.drift.repository.DriftAlertRepository;
import com.ethixai.drift.repository.DriftDailySummaryRepository;
import com.ethixai.drift.repository.DriftSnapshotRepository;
import com.ethixai.drift.service.notification.DriftNotificationEvent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static com.ethixai.drift.service.PersistenceTestConfig.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@RecordApplicationEvents
@Import({RetentionService.class, DriftProperties.class, PersistenceTestConfig.class})
class RetentionServiceTest {

    private static final LocalDate YESTERDAY = LocalDate.of(2026, 3, 1);

    @Autowired
    private RetentionService retentionService;

    @Autowired
    private DriftSnapshotRepository snapshotRepository;

    @Autowired
    private DriftAlertRepository alertRepository;

    @Autowired
    private DriftDailySummaryRepository summaryRepository;

    @Autowired
    private ApplicationEvents events;

    @Test
    void yesterdaysSnapshotsRollIntoOneSummaryPerModel() {
        snapshotRepository.saveAndFlush(snapshot("retention-a", Instant.parse("2026-03-01T01:00:00Z"), Severity.WARNING, 2, 1, false));
        snapshotRepository.saveAndFlush(snapshot("retention-a", Instant.parse("2026-03-01T13:00:00Z"), Severity.STABLE, 0, 3, true));
        snapshotRepository.saveAndFlush(snapshot("retention-a", Instant.parse("2026-03-02T01:00:00Z"), Severity.CRITICAL, 5, 0, false));

        int models = retentionService.aggregateDay(YESTERDAY);

        assertThat(models).isEqualTo(1);
        DriftDailySummary summary = summaryRepository.findByModelIdAndSummaryDate("retention-a", YESTERDAY).orElseThrow();
        assertThat(summary.getSnapshotCount()).isEqualTo(2);
        assertThat(summary.getAvgCriticalCount()).isCloseTo(1.0, within(1e-9));
        assertThat(summary.getMaxCriticalCount()).isEqualTo(2);
        assertThat(summary.getAvgWarningCount()).isCloseTo(2.0, within(1e-9));
        assertThat(summary.getMaxWarningCount()).isEqualTo(3);
        assertThat(summary.getOverallStatus()).isEqualTo(Severity.STABLE);
        assertThat(summary.isNeedsRetraining()).isTrue();
        assertThat(events.stream(DriftNotificationEvent.class)
                .filter(event -> event.kind() == DriftNotificationEvent.Kind.DAILY_SUMMARY)).hasSize(1);
    }

    @Test
    void rerunningAggregationOverwritesSummary() {
        snapshotRepository.saveAndFlush(snapshot("retention-b", Instant.parse("2026-03-01T08:00:00Z"), Severity.WARNING, 0, 1, false));
        retentionService.aggregateDay(YESTERDAY);
        snapshotRepository.saveAndFlush(snapshot("retention-b", Instant.parse("2026-03-01T09:00:00Z"), Severity.CRITICAL, 1, 0, false));

        retentionService.aggregateDay(YESTERDAY);

        List<DriftDailySummary> summaries = summaryRepository.findByModelIdOrderBySummaryDateDesc("retention-b");
        assertThat(summaries).hasSize(1);
        assertThat(summaries.get(0).getSnapshotCount()).isEqualTo(2);
        assertThat(summaries.get(0).getOverallStatus()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void cleanupRemovesOnlyExpiredRows() {
        snapshotRepository.saveAndFlush(snapshot("retention-c", NOW.minus(Duration.ofDays(40)), Severity.STABLE, 0, 0, false));
        DriftSnapshot recent = snapshotRepository.saveAndFlush(
                snapshot("retention-c", NOW.minus(Duration.ofDays(2)), Severity.STABLE, 0, 0, false));
        alertRepository.saveAndFlush(alert("retention-c", "psi_old", NOW.minus(Duration.ofDays(100))));
        alertRepository.saveAndFlush(alert("retention-c", "psi_new", NOW.minus(Duration.ofDays(1))));
        summaryRepository.saveAndFlush(summary("retention-c", YESTERDAY.minusDays(400)));
        summaryRepository.saveAndFlush(summary("retention-c", YESTERDAY.minusDays(10)));

        CleanupResult result = retentionService.runCleanup();

        assertThat(result.aggregation().success()).isTrue();
        assertThat(result.snapshotCleanup().affected()).isEqualTo(1);
        assertThat(result.alertCleanup().affected()).isEqualTo(1);
        assertThat(result.summaryArchive().affected()).isEqualTo(1);
        assertThat(snapshotRepository.countByModelId("retention-c")).isEqualTo(1);
        assertThat(snapshotRepository.existsById(recent.getId())).isTrue();
        assertThat(summaryRepository.findByModelIdOrderBySummaryDateDesc("retention-c"))
                .extracting(DriftDailySummary::getSummaryDate)
                .containsExactly(YESTERDAY.minusDays(10));
    }

    private static DriftSnapshot snapshot(String modelId, Instant windowEnd, Severity status, int critical,
                                          int warning, boolean retrain) {
        return DriftSnapshot.builder()
                .modelId(modelId)
                .mode(WindowMode.STREAMING)
                .windowStart(windowEnd.minus(Duration.ofMinutes(5)))
                .windowEnd(windowEnd)
                .sampleCount(100)
                .featureDrifts("{}")
                .fairnessDrift("{}")
                .dataQualityDrift("{}")
                .overallStatus(status)
                .criticalCount(critical)
                .warningCount(warning)
                .needsRetraining(retrain)
                .createdAt(windowEnd)
                .build();
    }

    private static DriftAlert alert(String modelId, String metric, Instant createdAt) {
        return DriftAlert.builder()
                .fingerprint(AlertFingerprint.of(modelId, AlertType.POPULATION_DRIFT, metric))
                .modelId(modelId)
                .type(AlertType.POPULATION_DRIFT)
                .severity(Severity.WARNING)
                .metricName(metric)
                .metricValue(0.2)
                .threshold(0.1)
                .windowStart(createdAt.minus(Duration.ofMinutes(5)))
                .windowEnd(createdAt)
                .resolved(true)
                .occurrenceCount(1)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    private static DriftDailySummary summary(String modelId, LocalDate date) {
        return DriftDailySummary.builder()
                .modelId(modelId)
                .summaryDate(date)
                .snapshotCount(1)
                .overallStatus(Severity.STABLE)
                .createdAt(NOW)
                .build();
    }
}
