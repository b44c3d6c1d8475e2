package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertListResponse {
    private String modelId;
    private int count;
    private List<AlertResponse> alerts;
}
