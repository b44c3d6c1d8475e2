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
public class FairnessDrift {
    private String attribute;
    private String group;
    private double baselineRate;
    private double currentRate;
    private double delta;
    private long currentCount;
    private Severity severity;
}
