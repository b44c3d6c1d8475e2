package com.ethixai.drift.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * A scored request as written by the evaluation pipeline. The drift engine only reads these.
 */
@Entity
@Table(name = "evaluation_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String features;

    private Double score;

    @Column(name = "protected_attributes", columnDefinition = "TEXT")
    private String protectedAttributes;

    @Column(name = "feature_importance", columnDefinition = "TEXT")
    private String featureImportance;

    @Column(name = "evaluated_at", nullable = false)
    private Instant evaluatedAt;
}
