package com.ethixai.drift.dto;

import com.ethixai.drift.model.Severity;
import com.ethixai.drift.model.WindowMode;
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
public class DriftSnapshotResponse {
    private Long id;
    private String modelId;
    private WindowMode mode;
    private Instant windowStart;
    private Instant windowEnd;
    private int sampleCount;
    private Map<String, FeatureDrift> featureDrifts;
    private ScoreDrift scoreDrift;
    private Map<String, FairnessDrift> fairnessDrift;
    private Map<String, DataQualityDrift> dataQualityDrift;
    private ExplanationDrift explanationDrift;
    private Severity overallStatus;
    private int criticalCount;
    private int warningCount;
    private boolean needsRetraining;
    private Instant createdAt;
}
