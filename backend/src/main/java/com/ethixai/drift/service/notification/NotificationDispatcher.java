package com.ethixai.drift.service.notification;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.service.DriftMetricsExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Fans drift notifications out to every channel once the publishing transaction has committed.
 * A failing channel is logged and counted; it never affects other channels or the caller.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final List<NotificationChannel> channels;
    private final DriftProperties properties;
    private final DriftMetricsExporter metricsExporter;

    @Async("notificationExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onNotification(DriftNotificationEvent event) {
        dispatch(event);
    }

    public int dispatch(DriftNotificationEvent event) {
        DriftProperties.Notifications settings = properties.getNotifications();
        if (!settings.isEnabled()) {
            return 0;
        }
        if (event.severity() != null && event.severity().compareTo(settings.getMinSeverity()) < 0
                && event.kind() != DriftNotificationEvent.Kind.DAILY_SUMMARY) {
            log.debug("Notification below minimum severity kind={} model={} severity={}",
                    event.kind(), event.modelId(), event.severity());
            return 0;
        }
        int delivered = 0;
        for (NotificationChannel channel : channels) {
            try {
                channel.send(event);
                delivered++;
            } catch (Exception e) {
                log.warn("Notification channel {} failed kind={} model={} error={}",
                        channel.name(), event.kind(), event.modelId(), e.getMessage());
                metricsExporter.recordNotificationFailure(channel.name());
            }
        }
        return delivered;
    }
}
