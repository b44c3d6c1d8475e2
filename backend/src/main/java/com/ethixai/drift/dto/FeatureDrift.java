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
public class FeatureDrift {
    private String feature;
    private double psi;
    private Severity severity;
}
