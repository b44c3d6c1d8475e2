package com.ethixai.drift.dto;

import com.ethixai.drift.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExplanationDrift {
    private double cosineSimilarity;
    private int featureCount;
    private Severity severity;
}
