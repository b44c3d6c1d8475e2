package com.ethixai.drift.dto;

import com.ethixai.drift.model.AlertType;
import com.ethixai.drift.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private Long id;
    private String fingerprint;
    private String modelId;
    private AlertType type;
    private Severity severity;
    private String metricName;
    private double metricValue;
    private double threshold;
    private Instant windowStart;
    private Instant windowEnd;
    private Map<String, Object> details;
    private boolean resolved;
    private Instant resolvedAt;
    private String resolutionNote;
    private int occurrenceCount;
    private Instant createdAt;
    private Instant updatedAt;
}
