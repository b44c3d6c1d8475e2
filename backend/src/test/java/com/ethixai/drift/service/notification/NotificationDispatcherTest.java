package com.ethixai.drift.service.notification;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.service.DriftMetricsExporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationDispatcherTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final DriftProperties properties = new DriftProperties();
    private final RecordingChannel recording = new RecordingChannel();

    @Test
    void failingChannelDoesNotStopOthers() {
        NotificationDispatcher dispatcher = dispatcher(List.of(new FailingChannel(), recording));

        int delivered = dispatcher.dispatch(event(DriftNotificationEvent.Kind.ALERT_CREATED, Severity.CRITICAL));

        assertThat(delivered).isEqualTo(1);
        assertThat(recording.received).hasSize(1);
        assertThat(registry.get("drift_notification_failures_total").tag("channel", "broken").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void belowMinimumSeverityIsDropped() {
        properties.getNotifications().setMinSeverity(Severity.CRITICAL);
        NotificationDispatcher dispatcher = dispatcher(List.of(recording));

        assertThat(dispatcher.dispatch(event(DriftNotificationEvent.Kind.ALERT_CREATED, Severity.WARNING))).isZero();
        assertThat(dispatcher.dispatch(event(DriftNotificationEvent.Kind.DAILY_SUMMARY, Severity.STABLE))).isEqualTo(1);
        assertThat(recording.received).extracting(DriftNotificationEvent::kind)
                .containsExactly(DriftNotificationEvent.Kind.DAILY_SUMMARY);
    }

    @Test
    void disabledNotificationsSendNothing() {
        properties.getNotifications().setEnabled(false);

        int delivered = dispatcher(List.of(recording))
                .dispatch(event(DriftNotificationEvent.Kind.RETRAIN_REQUESTED, Severity.CRITICAL));

        assertThat(delivered).isZero();
        assertThat(recording.received).isEmpty();
    }

    @Test
    void loggingChannelAcceptsEvents() {
        int delivered = dispatcher(List.of(new LoggingNotificationChannel()))
                .dispatch(event(DriftNotificationEvent.Kind.ALERT_ESCALATED, Severity.CRITICAL));

        assertThat(delivered).isEqualTo(1);
    }

    private NotificationDispatcher dispatcher(List<NotificationChannel> channels) {
        return new NotificationDispatcher(channels, properties, new DriftMetricsExporter(registry));
    }

    private static DriftNotificationEvent event(DriftNotificationEvent.Kind kind, Severity severity) {
        return new DriftNotificationEvent(kind, "fraud-v7", severity, "title", "message",
                Map.of("metric", "psi_amount"), Instant.parse("2026-03-02T12:00:00Z"));
    }

    private static final class RecordingChannel implements NotificationChannel {
        private final List<DriftNotificationEvent> received = new ArrayList<>();

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void send(DriftNotificationEvent event) {
            received.add(event);
        }
    }

    private static final class FailingChannel implements NotificationChannel {
        @Override
        public String name() {
            return "broken";
        }

        @Override
        public void send(DriftNotificationEvent event) throws Exception {
            throw new IOException("connection refused");
        }
    }
}
