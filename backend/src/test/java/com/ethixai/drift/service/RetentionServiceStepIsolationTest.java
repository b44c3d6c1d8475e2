package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.CleanupResult;
import com.ethixai.drift.repository.DriftAlertRepository;
import com.ethixai.drift.repository.DriftDailySummaryRepository;
import com.ethixai.drift.repository.DriftSnapshotRepository;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetentionServiceStepIsolationTest {

    @Test
    void failingStepDoesNotStopTheOthers() {
        DriftSnapshotRepository snapshotRepository = mock(DriftSnapshotRepository.class);
        DriftAlertRepository alertRepository = mock(DriftAlertRepository.class);
        DriftDailySummaryRepository summaryRepository = mock(DriftDailySummaryRepository.class);
        when(snapshotRepository.findByWindowEndGreaterThanEqualAndWindowEndLessThanOrderByModelIdAscWindowEndAscIdAsc(any(), any()))
                .thenReturn(List.of());
        when(snapshotRepository.deleteByWindowEndBefore(any())).thenThrow(new QueryTimeoutException("lock timeout"));
        when(alertRepository.deleteByCreatedAtBefore(any())).thenReturn(4);
        when(summaryRepository.deleteBySummaryDateBefore(any())).thenReturn(2);
        RetentionService service = new RetentionService(snapshotRepository, alertRepository, summaryRepository,
                mock(ApplicationEventPublisher.class), new DriftProperties(), mock(PlatformTransactionManager.class),
                Clock.fixed(Instant.parse("2026-03-02T03:00:00Z"), ZoneOffset.UTC));

        CleanupResult result = service.runCleanup();

        assertThat(result.aggregation()).isEqualTo(CleanupResult.StepResult.ok(0));
        assertThat(result.snapshotCleanup().success()).isFalse();
        assertThat(result.snapshotCleanup().error()).contains("lock timeout");
        assertThat(result.alertCleanup()).isEqualTo(CleanupResult.StepResult.ok(4));
        assertThat(result.summaryArchive()).isEqualTo(CleanupResult.StepResult.ok(2));
    }
}
