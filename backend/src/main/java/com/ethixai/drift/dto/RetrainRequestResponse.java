package com.ethixai.drift.dto;

import com.ethixai.drift.model.RetrainRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainRequestResponse {
    private Long id;
    private String modelId;
    private String reason;
    private String requestedBy;
    private boolean automatic;
    private RetrainRequest.Status status;
    private String statusNote;
    private Instant requestedAt;
    private Instant updatedAt;

    public static RetrainRequestResponse from(RetrainRequest request) {
        return RetrainRequestResponse.builder()
                .id(request.getId())
                .modelId(request.getModelId())
                .reason(request.getReason())
                .requestedBy(request.getRequestedBy())
                .automatic(request.isAutomatic())
                .status(request.getStatus())
                .statusNote(request.getStatusNote())
                .requestedAt(request.getRequestedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }
}
