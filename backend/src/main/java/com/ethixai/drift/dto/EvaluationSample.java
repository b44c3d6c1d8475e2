package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One scored row of the live window, decoded from the evaluation source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationSample {
    private Map<String, Object> features;
    private Double score;
    private Map<String, Object> protectedAttributes;
    private Map<String, Double> featureImportance;
    private Instant timestamp;
}
