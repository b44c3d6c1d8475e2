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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "drift_daily_summaries", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"model_id", "summary_date"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftDailySummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Column(name = "summary_date", nullable = false)
    private LocalDate summaryDate;

    @Column(name = "snapshot_count", nullable = false)
    private int snapshotCount;

    @Column(name = "avg_critical_count", nullable = false)
    private double avgCriticalCount;

    @Column(name = "max_critical_count", nullable = false)
    private int maxCriticalCount;

    @Column(name = "avg_warning_count", nullable = false)
    private double avgWarningCount;

    @Column(name = "max_warning_count", nullable = false)
    private int maxWarningCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_status", nullable = false, length = 16)
    private Severity overallStatus;

    @Column(name = "needs_retraining", nullable = false)
    private boolean needsRetraining;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
