package com.ethixai.drift.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One evaluated window for one model. Written once at the end of a drift cycle and never updated.
 */
@Entity
@Table(name = "drift_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WindowMode mode;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false)
    private Instant windowEnd;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;

    @Column(name = "feature_drifts", nullable = false, columnDefinition = "TEXT")
    private String featureDrifts;

    @Column(name = "score_drift", columnDefinition = "TEXT")
    private String scoreDrift;

    @Column(name = "fairness_drift", nullable = false, columnDefinition = "TEXT")
    private String fairnessDrift;

    @Column(name = "data_quality_drift", nullable = false, columnDefinition = "TEXT")
    private String dataQualityDrift;

    @Column(name = "explanation_drift", columnDefinition = "TEXT")
    private String explanationDrift;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_status", nullable = false, length = 16)
    private Severity overallStatus;

    @Column(name = "critical_count", nullable = false)
    private int criticalCount;

    @Column(name = "warning_count", nullable = false)
    private int warningCount;

    @Column(name = "needs_retraining", nullable = false)
    private boolean needsRetraining;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
