package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreDistribution {
    private long count;
    private double mean;
    private double std;
    private double min;
    private double max;
    // p5, p25, p50, p75, p95
    private Map<String, Double> percentiles;
    private FeatureHistogram histogram;
}
