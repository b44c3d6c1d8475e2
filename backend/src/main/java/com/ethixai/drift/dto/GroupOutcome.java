package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome rate of one protected-attribute group: the share of its rows scored at or above the positive threshold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupOutcome {
    private long count;
    private double positiveRate;
}
