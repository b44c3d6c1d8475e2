package com.ethixai.drift.service.notification;

/**
 * Outbound delivery of drift notifications. Implementations may throw; the dispatcher isolates failures.
 */
public interface NotificationChannel {

    String name();

    void send(DriftNotificationEvent event) throws Exception;
}
