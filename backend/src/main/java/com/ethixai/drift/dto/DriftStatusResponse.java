package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftStatusResponse {
    private String modelId;
    // STABLE, WARNING, CRITICAL or UNKNOWN when no snapshot exists yet
    private String currentStatus;
    private long criticalAlerts;
    private long warningAlerts;
    private boolean needsRetraining;
    private DriftSnapshotResponse latestSnapshot;
    private List<AlertResponse> activeAlerts;
    private Long baselineAgeDays;
}
