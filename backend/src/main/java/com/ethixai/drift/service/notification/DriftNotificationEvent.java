package com.ethixai.drift.service.notification;

import com.ethixai.drift.model.Severity;

import java.time.Instant;
import java.util.Map;

public record DriftNotificationEvent(Kind kind,
                                     String modelId,
                                     Severity severity,
                                     String title,
                                     String message,
                                     Map<String, Object> attributes,
                                     Instant occurredAt) {

    public enum Kind {
        ALERT_CREATED,
        ALERT_ESCALATED,
        RETRAIN_REQUESTED,
        DAILY_SUMMARY
    }
}
