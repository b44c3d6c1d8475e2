package com.ethixai.drift.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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

@Entity
@Table(name = "drift_baselines", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"model_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftBaseline {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Column(name = "score_field", nullable = false, length = 128)
    private String scoreField;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;

    // JSON payloads, see BaselineDocument for the decoded shape
    @Column(name = "feature_names", nullable = false, columnDefinition = "TEXT")
    private String featureNames;

    @Column(name = "protected_attributes", nullable = false, columnDefinition = "TEXT")
    private String protectedAttributes;

    @Column(name = "feature_histograms", nullable = false, columnDefinition = "TEXT")
    private String featureHistograms;

    @Column(name = "score_distribution", nullable = false, columnDefinition = "TEXT")
    private String scoreDistribution;

    @Column(name = "fairness_statistics", nullable = false, columnDefinition = "TEXT")
    private String fairnessStatistics;

    @Column(name = "data_quality_statistics", nullable = false, columnDefinition = "TEXT")
    private String dataQualityStatistics;

    @Column(name = "feature_importance", columnDefinition = "TEXT")
    private String featureImportance;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
