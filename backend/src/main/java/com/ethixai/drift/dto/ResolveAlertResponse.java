package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertResponse {
    private boolean success;
    private boolean alreadyResolved;
    private String message;
    private AlertResponse alert;
}
