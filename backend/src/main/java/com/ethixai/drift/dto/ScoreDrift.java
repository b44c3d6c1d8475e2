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
public class ScoreDrift {
    private double klDivergence;
    // secondary signal, not part of severity
    private double wasserstein;
    private double baselineMean;
    private double currentMean;
    private Severity severity;
}
