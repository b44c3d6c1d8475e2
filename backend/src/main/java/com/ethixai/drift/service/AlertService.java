package com.ethixai.drift.service;

import com.ethixai.drift.config.DriftProperties;
import com.ethixai.drift.dto.DriftSignal;
import com.ethixai.drift.exception.AlreadyResolvedException;
import com.ethixai.drift.exception.NotFoundException;
import com.ethixai.drift.exception.TransientStoreException;
import com.ethixai.drift.model.DriftAlert;
import com.ethixai.drift.model.Severity;
import com.ethixai.drift.repository.DriftAlertRepository;
import com.ethixai.drift.service.notification.DriftNotificationEvent;
import com.ethixai.drift.util.JsonCodec;
import com.ethixai.drift.util.StoreErrors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Alert manager. Turns drift signals into deduplicated alerts and decides when repeated critical drift
 * warrants retraining.
 * <p>
 * Each fingerprint has at most one active alert, marked by {@code active_fingerprint}. A recurrence within
 * the dedup window updates that alert in place; a later recurrence retires it and opens a new one.
 * Two writers racing to open the same fingerprint collide on the unique column and the loser surfaces a
 * {@link TransientStoreException}, so a retried cycle finds the winner's row and increments it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertService {

    private static final int REASON_METRIC_LIMIT = 5;
    private static final String ACTIVE_FINGERPRINT_CONSTRAINT = "uk_drift_alerts_active_fingerprint";

    private final DriftAlertRepository alertRepository;
    private final RetrainRequestService retrainRequestService;
    private final AuditEventService auditEventService;
    private final ApplicationEventPublisher eventPublisher;
    private final DriftProperties properties;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    @Transactional
    public List<DriftAlert> evaluate(String modelId, Instant windowStart, Instant windowEnd, List<DriftSignal> signals) {
        List<DriftAlert> touched = new ArrayList<>();
        for (DriftSignal signal : signals) {
            if (signal.severity() == null || !signal.severity().isAlerting()) {
                continue;
            }
            touched.add(record(modelId, windowStart, windowEnd, signal));
        }
        return touched;
    }

    /**
     * True when enough distinct critical alerts are open within the lookback. Requests retraining on the way;
     * repeated calls while a request is pending do not create another one.
     */
    @Transactional
    public boolean shouldTriggerRetrain(String modelId) {
        DriftProperties.Alerts settings = properties.getAlerts();
        Instant since = clock.instant().minus(settings.getRetrainLookback());
        long distinctCritical = alertRepository.countDistinctUnresolved(modelId, Severity.CRITICAL, since);
        if (distinctCritical < settings.getRetrainCriticalAlerts()) {
            return false;
        }
        List<String> metrics = alertRepository.findUnresolvedSince(modelId, Severity.CRITICAL, since).stream()
                .map(DriftAlert::getMetricName)
                .distinct()
                .sorted()
                .toList();
        String listed = metrics.stream().limit(REASON_METRIC_LIMIT).collect(Collectors.joining(", "));
        if (metrics.size() > REASON_METRIC_LIMIT) {
            listed += " and " + (metrics.size() - REASON_METRIC_LIMIT) + " more";
        }
        String reason = distinctCritical + " critical drift alerts within "
                + settings.getRetrainLookback().toHours() + "h: " + listed;
        retrainRequestService.requestAutomatic(modelId, reason);
        return true;
    }

    @Transactional
    public DriftAlert resolve(Long alertId, String resolutionNote, String actor) {
        DriftAlert alert = alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert " + alertId + " not found"));
        if (alert.isResolved()) {
            throw new AlreadyResolvedException(alertId);
        }
        Instant now = clock.instant();
        alert.setResolved(true);
        alert.setResolvedAt(now);
        alert.setResolutionNote(resolutionNote);
        alert.setActiveFingerprint(null);
        alert.setUpdatedAt(now);
        DriftAlert saved = alertRepository.save(alert);
        auditEventService.recordEvent(actor, alert.getModelId(), "ALERT_RESOLVED",
                "Alert " + alertId + " resolved", Map.of("alertId", alertId, "metric", alert.getMetricName()));
        eventPublisher.publishEvent(new AlertsChangedEvent(alert.getModelId()));
        log.info("Alert resolved id={} model={} metric={}", alertId, alert.getModelId(), alert.getMetricName());
        return saved;
    }

    @Transactional(readOnly = true)
    public Map<Severity, Long> openAlertCounts(String modelId) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        counts.put(Severity.WARNING, alertRepository.countByModelIdAndResolvedFalseAndSeverity(modelId, Severity.WARNING));
        counts.put(Severity.CRITICAL, alertRepository.countByModelIdAndResolvedFalseAndSeverity(modelId, Severity.CRITICAL));
        return counts;
    }

    private DriftAlert record(String modelId, Instant windowStart, Instant windowEnd, DriftSignal signal) {
        String fingerprint = AlertFingerprint.of(modelId, signal.type(), signal.metricName());
        Instant now = clock.instant();
        DriftAlert active = alertRepository.findByActiveFingerprint(fingerprint).orElse(null);
        if (active != null) {
            if (withinDedupWindow(active.getWindowEnd(), windowEnd)) {
                return recur(active, windowEnd, signal, now);
            }
            active.setActiveFingerprint(null);
            active.setUpdatedAt(now);
            alertRepository.saveAndFlush(active);
        }

        DriftAlert alert = DriftAlert.builder()
                .fingerprint(fingerprint)
                .activeFingerprint(fingerprint)
                .modelId(modelId)
                .type(signal.type())
                .severity(signal.severity())
                .metricName(signal.metricName())
                .metricValue(signal.value())
                .threshold(signal.threshold())
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .details(jsonCodec.write(signal.details()))
                .resolved(false)
                .occurrenceCount(1)
                .createdAt(now)
                .updatedAt(now)
                .build();
        DriftAlert saved;
        try {
            saved = alertRepository.saveAndFlush(alert);
        } catch (DataIntegrityViolationException e) {
            if (StoreErrors.violates(e, ACTIVE_FINGERPRINT_CONSTRAINT)) {
                throw new TransientStoreException("Concurrent alert insert for fingerprint " + fingerprint, e);
            }
            throw e;
        }
        log.info("Alert opened id={} model={} type={} metric={} severity={} value={}",
                saved.getId(), modelId, signal.type(), signal.metricName(), signal.severity(), signal.value());
        publish(DriftNotificationEvent.Kind.ALERT_CREATED, saved, now);
        return saved;
    }

    private DriftAlert recur(DriftAlert alert, Instant windowEnd, DriftSignal signal, Instant now) {
        Severity previous = alert.getSeverity();
        alert.setOccurrenceCount(alert.getOccurrenceCount() + 1);
        if (windowEnd.isAfter(alert.getWindowEnd())) {
            alert.setWindowEnd(windowEnd);
        }
        alert.setMetricValue(signal.value());
        alert.setThreshold(signal.threshold());
        alert.setSeverity(signal.severity());
        alert.setDetails(jsonCodec.write(signal.details()));
        alert.setUpdatedAt(now);
        DriftAlert saved = alertRepository.save(alert);
        log.debug("Alert recurred id={} metric={} occurrences={}", saved.getId(), saved.getMetricName(),
                saved.getOccurrenceCount());
        if (signal.severity().compareTo(previous) > 0) {
            log.info("Alert escalated id={} metric={} {} -> {}", saved.getId(), saved.getMetricName(), previous,
                    signal.severity());
            publish(DriftNotificationEvent.Kind.ALERT_ESCALATED, saved, now);
        }
        return saved;
    }

    private boolean withinDedupWindow(Instant activeWindowEnd, Instant detectionWindowEnd) {
        Duration gap = Duration.between(activeWindowEnd, detectionWindowEnd).abs();
        return gap.compareTo(properties.getAlerts().getDedupWindow()) <= 0;
    }

    private void publish(DriftNotificationEvent.Kind kind, DriftAlert alert, Instant now) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("alertId", alert.getId());
        attributes.put("type", alert.getType().name());
        attributes.put("metric", alert.getMetricName());
        attributes.put("value", alert.getMetricValue());
        attributes.put("threshold", alert.getThreshold());
        attributes.put("occurrences", alert.getOccurrenceCount());
        eventPublisher.publishEvent(new DriftNotificationEvent(
                kind,
                alert.getModelId(),
                alert.getSeverity(),
                alert.getSeverity() + " " + alert.getType().name().toLowerCase() + " on " + alert.getModelId(),
                alert.getMetricName() + " = " + alert.getMetricValue() + " (threshold " + alert.getThreshold() + ")",
                attributes,
                now));
    }
}
