package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.DriftSignal;
import com.ethixai.drift.model.AlertType;
import com.ethixai.drift.model.AuditEvent;
import com.ethixai.drift.model.DriftAlert;
import com.ethixai.drift.model.RetrainRequest;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.repository.AuditEventRepository;
import com.ethixai.drift.repository.DriftAlertRepository;
import com.ethixai.drift.repository.RetrainRequestRepository;
import com.ethixai.drift.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.ethixai.drift.service.PersistenceTestConfig.NOW;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs each service call in its own committed transaction, the way the API and the worker call them.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({AlertService.class, RetrainRequestService.class, AuditEventService.class, JsonCodec.class,
        DriftProperties.class, PersistenceTestConfig.class})
class AuditedWritesCommitTest {

    @Autowired
    private AlertService alertService;

    @Autowired
    private RetrainRequestService retrainRequestService;

    @Autowired
    private DriftAlertRepository alertRepository;

    @Autowired
    private RetrainRequestRepository retrainRequestRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @AfterEach
    void cleanUp() {
        auditEventRepository.deleteAll();
        retrainRequestRepository.deleteAll();
        alertRepository.deleteAll();
    }

    @Test
    void longManualReasonCommitsWithShortenedAuditDescription() {
        String reason = "r".repeat(1500);

        RetrainRequestService.RetrainSubmission submission =
                retrainRequestService.submitManual("audit-manual", reason, "ops");

        assertThat(submission.created()).isTrue();
        assertThat(retrainRequestRepository.findById(submission.request().getId()).orElseThrow().getReason())
                .isEqualTo(reason);
        List<AuditEvent> audit = auditEventRepository.findByModelIdOrderByCreatedAtDesc("audit-manual");
        assertThat(audit).hasSize(1);
        assertThat(audit.get(0).getDescription()).hasSize(AuditEvent.DESCRIPTION_LENGTH).endsWith("...");
    }

    @Test
    void oversizedAutomaticReasonIsClippedToColumn() {
        RetrainRequestService.RetrainSubmission submission =
                retrainRequestService.requestAutomatic("audit-auto", "a".repeat(2500));

        assertThat(retrainRequestRepository.findById(submission.request().getId()).orElseThrow().getReason())
                .hasSize(RetrainRequest.REASON_LENGTH);
        assertThat(auditEventRepository.findByModelIdOrderByCreatedAtDesc("audit-auto")).hasSize(1);
    }

    @Test
    void longActorDoesNotUndoResolution() {
        DriftAlert alert = alertService.evaluate("audit-resolve", NOW.minus(Duration.ofMinutes(5)), NOW,
                List.of(new DriftSignal(AlertType.POPULATION_DRIFT, "psi_age", 0.3, 0.25, Severity.CRITICAL,
                        Map.of()))).get(0);

        alertService.resolve(alert.getId(), "ok", "a".repeat(200));

        assertThat(alertRepository.findById(alert.getId()).orElseThrow().isResolved()).isTrue();
        List<AuditEvent> audit = auditEventRepository.findByModelIdOrderByCreatedAtDesc("audit-resolve");
        assertThat(audit).extracting(AuditEvent::getAction).containsExactly("ALERT_RESOLVED");
        assertThat(audit.get(0).getActor()).hasSize(AuditEvent.ACTOR_LENGTH);
    }

    @Test
    void manyCriticalSignalsStillRequestRetraining() {
        List<DriftSignal> signals = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            signals.add(new DriftSignal(AlertType.POPULATION_DRIFT, "psi_feature_" + i + "_" + "x".repeat(150),
                    0.4, 0.25, Severity.CRITICAL, Map.of()));
        }
        alertService.evaluate("audit-many", NOW.minus(Duration.ofMinutes(5)), NOW, signals);

        assertThat(alertService.shouldTriggerRetrain("audit-many")).isTrue();

        assertThat(retrainRequestRepository.findByPendingModelId("audit-many")).isPresent();
        assertThat(auditEventRepository.findByModelIdOrderByCreatedAtDesc("audit-many"))
                .extracting(AuditEvent::getAction).containsExactly("RETRAIN_REQUESTED");
    }
}
