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
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "retrain_requests", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"pending_model_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainRequest {

    public static final int REASON_LENGTH = 2000;
    public static final int REQUESTED_BY_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    // set to modelId only while PENDING
    @Column(name = "pending_model_id", length = 128)
    private String pendingModelId;

    @Column(nullable = false, length = REASON_LENGTH)
    private String reason;

    @Column(name = "requested_by", nullable = false, length = REQUESTED_BY_LENGTH)
    private String requestedBy;

    @Column(nullable = false)
    private boolean automatic;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Status status;

    @Column(name = "status_note", length = 2000)
    private String statusNote;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public enum Status {
        PENDING,
        IN_PROGRESS,
        COMPLETED,
        REJECTED;

        public Set<Status> allowedTargets() {
            return switch (this) {
                case PENDING -> EnumSet.of(IN_PROGRESS, REJECTED);
                case IN_PROGRESS -> EnumSet.of(COMPLETED, REJECTED);
                case COMPLETED, REJECTED -> EnumSet.noneOf(Status.class);
            };
        }
    }
}
