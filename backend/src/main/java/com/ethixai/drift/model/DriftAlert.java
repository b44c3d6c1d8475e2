package com.ethixai.drift.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "drift_alerts", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"active_fingerprint"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    /**
     * Equal to {@link #fingerprint} while this alert is the one that absorbs recurrences,
     * null once it is resolved or superseded. The unique constraint on this column keeps
     * concurrent writers from opening two alerts for the same condition.
     */
    @Column(name = "active_fingerprint", length = 64)
    private String activeFingerprint;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(name = "metric_name", nullable = false)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private double metricValue;

    @Column(nullable = false)
    private double threshold;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false)
    private Instant windowEnd;

    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_note", length = 2000)
    private String resolutionNote;

    @Column(name = "occurrence_count", nullable = false)
    private int occurrenceCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
