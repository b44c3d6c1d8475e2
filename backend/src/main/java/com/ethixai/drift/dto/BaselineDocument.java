package com.ethixai.drift.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decoded reference statistics of one model. This is both the in-memory form cached by the baseline store
 * and the export/import format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineDocument {

    @NotBlank
    private String modelId;

    @NotBlank
    private String scoreField;

    private int sampleCount;

    @NotEmpty
    private List<String> featureNames;

    private List<String> protectedAttributes;

    @NotNull
    private Map<String, FeatureHistogram> featureHistograms;

    @NotNull
    private ScoreDistribution scoreDistribution;

    // attribute -> group -> outcome
    private Map<String, Map<String, GroupOutcome>> fairnessStatistics;

    private Map<String, FeatureQuality> dataQualityStatistics;

    private Map<String, Double> featureImportance;

    private Instant createdAt;
}
