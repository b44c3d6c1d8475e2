package com.ethixai.drift.service;

import com.ethixai.drift.exception.ConflictException;
import com.ethixai.drift.exception.NotFoundException;
import com.ethixai.drift.exception.TransientStoreException;
import com.ethixai.drift.model.RetrainRequest;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.repository.RetrainRequestRepository;
import com.ethixai.drift.service.notification.DriftNotificationEvent;
import com.ethixai.drift.util.ModelIds;
import com.ethixai.drift.util.StoreErrors;
import com.ethixai.drift.util.Texts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Retrain requests. At most one PENDING request exists per model; the unique {@code pending_model_id}
 * column enforces this across concurrent writers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetrainRequestService {

    private static final String PENDING_CONSTRAINT = "uk_retrain_requests_pending";

    private final RetrainRequestRepository retrainRequestRepository;
    private final AuditEventService auditEventService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public RetrainSubmission requestAutomatic(String modelId, String reason) {
        return submit(modelId, reason, AuditEventService.SYSTEM_ACTOR, true);
    }

    @Transactional
    public RetrainSubmission submitManual(String modelId, String reason, String requestedBy) {
        ModelIds.validate(modelId);
        return submit(modelId, reason, requestedBy == null || requestedBy.isBlank() ? "api" : requestedBy, false);
    }

    @Transactional
    public RetrainRequest updateStatus(Long requestId, RetrainRequest.Status target, String note, String actor) {
        RetrainRequest request = retrainRequestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Retrain request " + requestId + " not found"));
        RetrainRequest.Status current = request.getStatus();
        if (!current.allowedTargets().contains(target)) {
            throw new ConflictException("Retrain request " + requestId + " cannot move from " + current + " to " + target);
        }
        request.setStatus(target);
        request.setPendingModelId(null);
        request.setStatusNote(note);
        request.setUpdatedAt(clock.instant());
        RetrainRequest saved = retrainRequestRepository.save(request);
        auditEventService.recordEvent(actor, request.getModelId(), "RETRAIN_STATUS_CHANGED",
                "Retrain request " + requestId + " moved from " + current + " to " + target,
                Map.of("requestId", requestId, "from", current.name(), "to", target.name()));
        log.info("Retrain request {} for model {} moved {} -> {}", requestId, request.getModelId(), current, target);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<RetrainRequest> list(String modelId) {
        ModelIds.validate(modelId);
        return retrainRequestRepository.findByModelIdOrderByRequestedAtDesc(modelId);
    }

    @Transactional(readOnly = true)
    public Optional<RetrainRequest> pending(String modelId) {
        return retrainRequestRepository.findByPendingModelId(modelId);
    }

    private RetrainSubmission submit(String modelId, String rawReason, String rawRequestedBy, boolean automatic) {
        String reason = Texts.clip(rawReason, RetrainRequest.REASON_LENGTH);
        String requestedBy = Texts.clip(rawRequestedBy, RetrainRequest.REQUESTED_BY_LENGTH);
        Optional<RetrainRequest> pending = retrainRequestRepository.findByPendingModelId(modelId);
        if (pending.isPresent()) {
            log.debug("Retrain request already pending model={} id={}", modelId, pending.get().getId());
            return new RetrainSubmission(pending.get(), false);
        }
        Instant now = clock.instant();
        RetrainRequest request = RetrainRequest.builder()
                .modelId(modelId)
                .pendingModelId(modelId)
                .reason(reason)
                .requestedBy(requestedBy)
                .automatic(automatic)
                .status(RetrainRequest.Status.PENDING)
                .requestedAt(now)
                .updatedAt(now)
                .build();
        RetrainRequest saved;
        try {
            saved = retrainRequestRepository.saveAndFlush(request);
        } catch (DataIntegrityViolationException e) {
            if (!StoreErrors.violates(e, PENDING_CONSTRAINT)) {
                throw e;
            }
            // another writer created the pending request first; a retry will pick it up
            throw new TransientStoreException("Concurrent retrain request for model " + modelId, e);
        }
        auditEventService.recordEvent(requestedBy, modelId, "RETRAIN_REQUESTED", reason,
                Map.of("requestId", saved.getId(), "automatic", automatic));
        eventPublisher.publishEvent(new DriftNotificationEvent(
                DriftNotificationEvent.Kind.RETRAIN_REQUESTED,
                modelId,
                Severity.CRITICAL,
                "Retraining requested for " + modelId,
                reason,
                Map.of("requestId", saved.getId(), "automatic", automatic, "requestedBy", requestedBy),
                now));
        log.info("Retrain request created model={} id={} automatic={}", modelId, saved.getId(), automatic);
        return new RetrainSubmission(saved, true);
    }

    public record RetrainSubmission(RetrainRequest request, boolean created) {
    }
}
