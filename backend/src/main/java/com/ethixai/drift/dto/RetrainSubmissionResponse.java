package com.ethixai.drift.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrainSubmissionResponse {
    private boolean success;
    // false when an already pending request was returned
    private boolean created;
    private String message;
    private RetrainRequestResponse request;
}
