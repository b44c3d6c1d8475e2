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

@Entity
@Table(name = "drift_audit_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    public static final int ACTOR_LENGTH = 128;
    public static final int ACTION_LENGTH = 64;
    public static final int DESCRIPTION_LENGTH = 1000;
    public static final int CORRELATION_ID_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = ACTOR_LENGTH)
    private String actor;

    @Column(name = "model_id", length = 128)
    private String modelId;

    @Column(nullable = false, length = ACTION_LENGTH)
    private String action;

    @Column(nullable = false, length = DESCRIPTION_LENGTH)
    private String description;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "correlation_id", length = CORRELATION_ID_LENGTH)
    private String correlationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
