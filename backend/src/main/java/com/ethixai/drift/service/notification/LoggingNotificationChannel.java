package com.ethixai.drift.service.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(DriftNotificationEvent event) {
        log.info("Drift notification kind={} model={} severity={} title=\"{}\" message=\"{}\" attributes={}",
                event.kind(), event.modelId(), event.severity(), event.title(), event.message(), event.attributes());
    }
}
