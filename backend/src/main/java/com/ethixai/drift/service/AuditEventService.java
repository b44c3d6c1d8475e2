package com.ethixai.drift.service;

import com.ethixai.drift.config.RequestCorrelationFilter;
import com.ethixai.drift.model.AuditEvent;
import com.ethixai.drift.repository.AuditEventRepository;
import com.ethixai.drift.util.JsonCodec;
import com.ethixai.drift.util.ModelIds;
import com.ethixai.drift.util.Texts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String SYSTEM_ACTOR = "drift-engine";

    private final AuditEventRepository auditEventRepository;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    public void recordEvent(String actor, String modelId, String action, String description, Object metadata) {
        try {
            // the row is written in the caller's transaction: a rejected insert would roll the caller back too
            AuditEvent event = AuditEvent.builder()
                    .actor(Texts.clip(actor == null || actor.isBlank() ? SYSTEM_ACTOR : actor, AuditEvent.ACTOR_LENGTH))
                    .modelId(modelId != null && ModelIds.isValid(modelId) ? modelId : null)
                    .action(Texts.clip(action, AuditEvent.ACTION_LENGTH))
                    .description(Texts.clip(description == null || description.isBlank() ? action : description,
                            AuditEvent.DESCRIPTION_LENGTH))
                    .metadata(jsonCodec.write(metadata))
                    .correlationId(Texts.clip(MDC.get(RequestCorrelationFilter.CORRELATION_ID_KEY),
                            AuditEvent.CORRELATION_ID_LENGTH))
                    .createdAt(clock.instant())
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {} for model {} - {}", action, modelId, e.getMessage());
        }
    }
}
