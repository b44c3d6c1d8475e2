package com.ethixai.drift.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBaselineRequest {

    // rows keyed by column name; emptiness is reported as insufficient data
    @NotNull
    private List<Map<String, Object>> referenceSamples;

    @NotEmpty
    private List<String> featureNames;

    @NotBlank
    private String scoreField;

    private List<String> protectedAttributes;

    private Map<String, Double> featureImportance;
}
