package com.ethixai.drift.dto;

import com.ethixai.drift.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataQualityDrift {
    private String feature;
    private double baselineNullRate;
    private double currentNullRate;
    private double nullRateDelta;
    private Severity nullRateSeverity;
    private List<String> newCategories;
    // share of window rows carrying a category absent from the baseline
    private double newCategoryRate;
    private boolean newCategoryFlag;
    private Severity newCategorySeverity;

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public Severity getSeverity() {
        return Severity.worst(nullRateSeverity, newCategorySeverity);
    }
}
